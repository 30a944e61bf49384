package com.starscape.bracketflow.features.jobs.domain.events;

import com.starscape.bracketflow.common.domain.DomainEvent;

import java.time.Instant;
import java.util.Map;

public record GroupingProgress(String jobId, int progress, Instant occurredOn) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "grouping_progress";
    }
    
    @Override
    public String getAggregateId() {
        return jobId;
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
    
    @Override
    public Map<String, Object> toPayload() {
        return Map.of("progress", progress);
    }
}
