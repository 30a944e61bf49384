package com.starscape.bracketflow.features.trackprogress.app;

import com.starscape.bracketflow.features.jobs.app.JobLookup;
import com.starscape.bracketflow.features.jobs.domain.JobRepository;
import com.starscape.bracketflow.features.trackprogress.domain.EventSink;
import com.starscape.bracketflow.features.trackprogress.domain.JobEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Opens a live event stream for a job, replacing any stream already open for it.
 */
@Service
public class SubscribeToJobEventsHandler {
    
    private static final Logger log = LoggerFactory.getLogger(SubscribeToJobEventsHandler.class);
    
    private final JobLookup jobLookup;
    private final JobRepository jobRepository;
    private final JobEventRepository eventRepository;
    private final JobSubscriberRegistry subscriberRegistry;
    
    public SubscribeToJobEventsHandler(
            JobLookup jobLookup,
            JobRepository jobRepository,
            JobEventRepository eventRepository,
            JobSubscriberRegistry subscriberRegistry) {
        this.jobLookup = jobLookup;
        this.jobRepository = jobRepository;
        this.eventRepository = eventRepository;
        this.subscriberRegistry = subscriberRegistry;
    }
    
    /**
     * @param resumeAfter last sequence the client has seen, or null to receive only new events
     */
    public JobEventSubscription handle(String jobId, String userId, Long resumeAfter, EventSink sink) {
        jobLookup.requireOwned(jobId, userId);
        
        JobEventSubscription subscription = new JobEventSubscription(jobId, sink, eventRepository);
        // Attach before reading the log position so nothing committed in between is lost.
        subscriberRegistry.attach(subscription);
        
        long start;
        if (resumeAfter != null && resumeAfter >= 0) {
            start = resumeAfter;
        } else {
            start = jobRepository.findById(jobId).map(job -> job.getLastEventSequence()).orElse(0L);
        }
        log.info("Subscriber attached to job {} after sequence {}", jobId, start);
        subscription.start(start);
        return subscription;
    }
}
