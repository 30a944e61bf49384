package com.starscape.bracketflow.features.jobs.domain.events;

import com.starscape.bracketflow.common.domain.DomainEvent;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record DispatchStarted(
    String jobId,
    String mode,
    String manifestHash,
    int fileCount,
    int queuePending,
    long etaSeconds,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "dispatch_started";
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
        payload.put("mode", mode);
        payload.put("manifest_hash", manifestHash);
        payload.put("files", fileCount);
        payload.put("queue_pending", queuePending);
        payload.put("eta_seconds", etaSeconds);
        return payload;
    }
}
