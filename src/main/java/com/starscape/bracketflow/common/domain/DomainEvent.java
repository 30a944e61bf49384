package com.starscape.bracketflow.common.domain;

import java.time.Instant;
import java.util.Map;

public interface DomainEvent {
    String getEventType();
    String getAggregateId();
    Instant getOccurredOn();

    /**
     * Client-facing body of the event as written to the job event log.
     */
    Map<String, Object> toPayload();
}
