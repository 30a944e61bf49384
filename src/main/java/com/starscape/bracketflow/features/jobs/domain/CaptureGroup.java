package com.starscape.bracketflow.features.jobs.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One unit of billable work: an HDR bracket or a single frame. Groups are replaced
 * wholesale on every grouping run; only their processing status changes afterwards.
 */
@Entity
@Table(name = "capture_groups",
    uniqueConstraints = @UniqueConstraint(name = "uq_capture_groups_job_index", columnNames = {"job_id", "group_index"}))
public class CaptureGroup {

    @Id
    @Column(name = "group_id")
    private String groupId;

    @Column(name = "job_id", nullable = false)
    private String jobId;

    @Column(name = "group_index", nullable = false)
    private int groupIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "group_type", nullable = false)
    private GroupType groupType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private GroupStatus status;

    @Column(name = "hdr_confidence")
    private Double hdrConfidence;

    @Column(name = "group_size", nullable = false)
    private int groupSize;

    @Column(name = "representative_file_id")
    private String representativeFileId;

    @Column(name = "representative_index", nullable = false)
    private int representativeIndex;

    @Column(name = "output_filename")
    private String outputFilename;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "result_key", length = 1024)
    private String resultKey;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected CaptureGroup() {
        // JPA constructor
    }

    public CaptureGroup(String groupId, String jobId, int groupIndex, GroupType groupType,
                        Double hdrConfidence, int groupSize, String representativeFileId,
                        int representativeIndex, String outputFilename) {
        this.groupId = groupId;
        this.jobId = jobId;
        this.groupIndex = groupIndex;
        this.groupType = groupType;
        this.status = GroupStatus.QUEUED;
        this.hdrConfidence = hdrConfidence;
        this.groupSize = groupSize;
        this.representativeFileId = representativeFileId;
        this.representativeIndex = representativeIndex;
        this.outputFilename = outputFilename;
        this.attempts = 0;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getJobId() {
        return jobId;
    }

    public int getGroupIndex() {
        return groupIndex;
    }

    public GroupType getGroupType() {
        return groupType;
    }

    public GroupStatus getStatus() {
        return status;
    }

    public Double getHdrConfidence() {
        return hdrConfidence;
    }

    public int getGroupSize() {
        return groupSize;
    }

    public String getRepresentativeFileId() {
        return representativeFileId;
    }

    public int getRepresentativeIndex() {
        return representativeIndex;
    }

    public String getOutputFilename() {
        return outputFilename;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getResultKey() {
        return resultKey;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean isAwaitingResult() {
        return status == GroupStatus.QUEUED || status == GroupStatus.PROCESSING;
    }

    public boolean isRetryable(int maxAttempts) {
        return status == GroupStatus.FAILED && attempts < maxAttempts;
    }

    public void skip() {
        if (status != GroupStatus.QUEUED && status != GroupStatus.SKIPPED) {
            throw new IllegalStateException("Group " + groupId + " cannot be skipped in status " + status);
        }
        transitionTo(GroupStatus.SKIPPED);
    }

    /**
     * Puts the group back in line for a fresh run: on start, on resume after a skip, or on retry.
     */
    public void requeue() {
        if (status == GroupStatus.SUCCEEDED) {
            throw new IllegalStateException("Group " + groupId + " already succeeded");
        }
        this.lastError = null;
        transitionTo(GroupStatus.QUEUED);
    }

    public void resetForStart() {
        this.attempts = 0;
        this.resultKey = null;
        requeue();
    }

    public void markProcessing() {
        if (status == GroupStatus.QUEUED) {
            transitionTo(GroupStatus.PROCESSING);
        }
    }

    public void markSucceeded(String resultKey) {
        this.resultKey = resultKey;
        this.lastError = null;
        transitionTo(GroupStatus.SUCCEEDED);
    }

    public void markFailed(String error) {
        this.attempts++;
        this.lastError = error;
        transitionTo(GroupStatus.FAILED);
    }

    /**
     * Terminal failure that does not consume a retry attempt (cancellation).
     */
    public void abandon(String reason) {
        this.lastError = reason;
        transitionTo(GroupStatus.FAILED);
    }

    /**
     * Undo a requeue after the dispatch that would have run it failed.
     */
    public void restore(GroupStatus previous, String previousError) {
        this.lastError = previousError;
        transitionTo(previous);
    }

    private void transitionTo(GroupStatus next) {
        this.status = next;
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
