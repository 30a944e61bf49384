package com.starscape.bracketflow.features.trackprogress.app;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SubscriberHeartbeat {
    
    private final JobSubscriberRegistry subscriberRegistry;
    
    public SubscriberHeartbeat(JobSubscriberRegistry subscriberRegistry) {
        this.subscriberRegistry = subscriberRegistry;
    }
    
    @Scheduled(fixedRate = 15000)  // Every 15 seconds
    public void beat() {
        subscriberRegistry.heartbeatAll();
    }
}
