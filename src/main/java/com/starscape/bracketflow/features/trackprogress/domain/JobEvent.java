package com.starscape.bracketflow.features.trackprogress.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Immutable entry of a job's event log. Sequences are per job, start at 1 and have no gaps.
 */
@Entity
@Table(name = "job_events",
    uniqueConstraints = @UniqueConstraint(name = "uq_job_events_job_sequence", columnNames = {"job_id", "sequence"}))
public class JobEvent {
    
    @Id
    @Column(name = "event_id")
    private String eventId;
    
    @Column(name = "job_id", nullable = false, updatable = false)
    private String jobId;
    
    @Column(nullable = false, updatable = false)
    private long sequence;
    
    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    private String payload;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected JobEvent() {
        // JPA constructor
    }
    
    public JobEvent(String eventId, String jobId, long sequence, String eventType, String payload, Instant createdAt) {
        this.eventId = eventId;
        this.jobId = jobId;
        this.sequence = sequence;
        this.eventType = eventType;
        this.payload = payload;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }
    
    public String getEventId() { return eventId; }
    public String getJobId() { return jobId; }
    public long getSequence() { return sequence; }
    public String getEventType() { return eventType; }
    public String getPayload() { return payload; }
    public Instant getCreatedAt() { return createdAt; }
}
