package com.starscape.bracketflow.features.jobs.domain.events;

import com.starscape.bracketflow.common.domain.DomainEvent;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A grouping run committed. Items carry one summary per capture group in index order.
 */
public record JobGrouped(
    String jobId,
    int totalFiles,
    int totalGroups,
    List<Map<String, Object>> items,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "grouped";
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
        payload.put("total_files", totalFiles);
        payload.put("total_groups", totalGroups);
        payload.put("items", items);
        return payload;
    }
}
