package com.starscape.bracketflow.features.jobs.domain.events;

import com.starscape.bracketflow.common.domain.DomainEvent;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroup;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record GroupStatusChanged(
    String jobId,
    String groupId,
    int groupIndex,
    String status,
    String error,
    Instant occurredOn
) implements DomainEvent {
    
    public static GroupStatusChanged of(CaptureGroup group) {
        return new GroupStatusChanged(
            group.getJobId(),
            group.getGroupId(),
            group.getGroupIndex(),
            group.getStatus().wireValue(),
            group.getLastError(),
            Instant.now()
        );
    }
    
    @Override
    public String getEventType() {
        return "group_status_changed";
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
        payload.put("group_id", groupId);
        payload.put("index", groupIndex);
        payload.put("status", status);
        if (error != null) {
            payload.put("error", error);
        }
        return payload;
    }
}
