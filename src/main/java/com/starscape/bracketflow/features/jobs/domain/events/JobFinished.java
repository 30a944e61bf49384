package com.starscape.bracketflow.features.jobs.domain.events;

import com.starscape.bracketflow.common.domain.DomainEvent;
import com.starscape.bracketflow.features.jobs.domain.JobStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final event of a job. Live streams close after delivering it.
 */
public record JobFinished(
    String jobId,
    JobStatus status,
    int succeeded,
    int failed,
    String error,
    Instant occurredOn
) implements DomainEvent {
    
    public static final String TYPE = "job_done";
    
    @Override
    public String getEventType() {
        return TYPE;
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
        payload.put("succeeded", succeeded);
        payload.put("failed", failed);
        if (error != null) {
            payload.put("error", error);
        }
        return payload;
    }
}
