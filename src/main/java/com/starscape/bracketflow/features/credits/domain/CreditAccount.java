package com.starscape.bracketflow.features.credits.domain;

import com.starscape.bracketflow.common.exception.InsufficientCreditsException;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Per-user credit balance split into available, reserved and spent.
 * The total only grows through deposits; every other move keeps it constant.
 */
@Entity
@Table(name = "credit_accounts")
public class CreditAccount {
    
    @Id
    @Column(name = "user_id")
    private String userId;
    
    @Column(nullable = false)
    private long available;
    
    @Column(nullable = false)
    private long reserved;
    
    @Column(nullable = false)
    private long spent;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected CreditAccount() {
        // JPA constructor
    }
    
    public CreditAccount(String userId) {
        this.userId = userId;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }
    
    public String getUserId() {
        return userId;
    }
    
    public long getAvailable() {
        return available;
    }
    
    public long getReserved() {
        return reserved;
    }
    
    public long getSpent() {
        return spent;
    }
    
    public CreditBalance balance(boolean applied) {
        return new CreditBalance(available, reserved, spent, applied);
    }
    
    public void deposit(long amount) {
        this.available += amount;
        touch();
    }
    
    public void reserve(long amount) {
        if (amount > available) {
            throw new InsufficientCreditsException(amount, available);
        }
        this.available -= amount;
        this.reserved += amount;
        touch();
    }
    
    public void release(long amount) {
        requireReserved(amount);
        this.reserved -= amount;
        this.available += amount;
        touch();
    }
    
    public void settle(long amount) {
        requireReserved(amount);
        this.reserved -= amount;
        this.spent += amount;
        touch();
    }
    
    private void requireReserved(long amount) {
        if (amount > reserved) {
            throw new IllegalStateException(String.format(
                "Account %s holds %d reserved credits, cannot move %d", userId, reserved, amount));
        }
    }
    
    private void touch() {
        this.updatedAt = Instant.now();
    }
}
