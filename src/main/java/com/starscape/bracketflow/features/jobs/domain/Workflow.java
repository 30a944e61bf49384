package com.starscape.bracketflow.features.jobs.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Processing recipe a job runs through. Managed by administrators elsewhere; read-only here.
 */
@Entity
@Table(name = "workflows")
public class Workflow {
    
    @Id
    @Column(name = "workflow_id")
    private String workflowId;
    
    @Column(nullable = false, unique = true)
    private String slug;
    
    @Column(name = "display_name", nullable = false)
    private String displayName;
    
    @Column(name = "credit_per_unit", nullable = false)
    private int creditPerUnit;
    
    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;
    
    @Column(nullable = false)
    private boolean active;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected Workflow() {
        // JPA constructor
    }
    
    public Workflow(String workflowId, String slug, String displayName, int creditPerUnit, int maxAttempts) {
        if (creditPerUnit < 1) {
            throw new IllegalArgumentException("creditPerUnit must be positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.workflowId = workflowId;
        this.slug = slug;
        this.displayName = displayName;
        this.creditPerUnit = creditPerUnit;
        this.maxAttempts = maxAttempts;
        this.active = true;
        this.createdAt = Instant.now();
    }
    
    public String getWorkflowId() {
        return workflowId;
    }
    
    public String getSlug() {
        return slug;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    public int getCreditPerUnit() {
        return creditPerUnit;
    }
    
    public int getMaxAttempts() {
        return maxAttempts;
    }
    
    public boolean isActive() {
        return active;
    }
}
