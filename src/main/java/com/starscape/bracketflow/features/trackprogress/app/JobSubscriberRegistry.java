package com.starscape.bracketflow.features.trackprogress.app;

import com.starscape.bracketflow.features.trackprogress.domain.JobEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * At most one live subscriber per job. Attaching a new one closes the previous connection.
 */
@Component
public class JobSubscriberRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(JobSubscriberRegistry.class);
    
    private final ConcurrentMap<String, JobEventSubscription> subscribers = new ConcurrentHashMap<>();
    
    public void attach(JobEventSubscription subscription) {
        subscription.onClose(() -> detach(subscription));
        JobEventSubscription previous = subscribers.put(subscription.getJobId(), subscription);
        if (previous != null && previous != subscription) {
            log.info("Replacing live subscriber of job {}", subscription.getJobId());
            previous.close();
        }
    }
    
    /**
     * Teardown hook: removes the entry only if it is still this subscription.
     */
    public void detach(JobEventSubscription subscription) {
        subscribers.remove(subscription.getJobId(), subscription);
    }
    
    public Optional<JobEventSubscription> find(String jobId) {
        return Optional.ofNullable(subscribers.get(jobId));
    }
    
    public void deliver(JobEvent event) {
        JobEventSubscription subscription = subscribers.get(event.getJobId());
        if (subscription != null) {
            subscription.offer(event);
        }
    }
    
    public void heartbeatAll() {
        new ArrayList<>(subscribers.values()).forEach(JobEventSubscription::heartbeat);
    }
    
    public int size() {
        return subscribers.size();
    }
    
    @PreDestroy
    public void closeAll() {
        new ArrayList<>(subscribers.values()).forEach(JobEventSubscription::close);
        subscribers.clear();
    }
}
