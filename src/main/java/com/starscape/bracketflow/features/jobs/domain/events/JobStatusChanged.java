package com.starscape.bracketflow.features.jobs.domain.events;

import com.starscape.bracketflow.common.domain.DomainEvent;
import com.starscape.bracketflow.features.jobs.domain.JobStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record JobStatusChanged(
    String jobId,
    JobStatus status,
    JobStatus previousStatus,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "job_status_changed";
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
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status.wireValue());
        payload.put("previous_status", previousStatus == null ? null : previousStatus.wireValue());
        return payload;
    }
}
