package com.starscape.bracketflow.features.credits.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Journal line of one applied ledger operation. The unique key is what makes retries safe.
 */
@Entity
@Table(name = "credit_ledger_entries",
    uniqueConstraints = @UniqueConstraint(name = "uq_credit_ledger_key", columnNames = "idempotency_key"),
    indexes = @Index(name = "idx_credit_ledger_job", columnList = "job_id"))
public class CreditLedgerEntry {
    
    @Id
    @Column(name = "entry_id")
    private String entryId;
    
    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;
    
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;
    
    @Column(name = "job_id", updatable = false)
    private String jobId;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, updatable = false)
    private LedgerEntryType type;
    
    @Column(nullable = false, updatable = false)
    private long amount;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected CreditLedgerEntry() {
        // JPA constructor
    }
    
    public CreditLedgerEntry(String entryId, String idempotencyKey, String userId, String jobId,
                             LedgerEntryType type, long amount) {
        this.entryId = entryId;
        this.idempotencyKey = idempotencyKey;
        this.userId = userId;
        this.jobId = jobId;
        this.type = type;
        this.amount = amount;
        this.createdAt = Instant.now();
    }
    
    public String getEntryId() { return entryId; }
    public String getIdempotencyKey() { return idempotencyKey; }
    public String getUserId() { return userId; }
    public String getJobId() { return jobId; }
    public LedgerEntryType getType() { return type; }
    public long getAmount() { return amount; }
    public Instant getCreatedAt() { return createdAt; }
}
