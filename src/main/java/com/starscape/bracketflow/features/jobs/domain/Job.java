package com.starscape.bracketflow.features.jobs.domain;

import com.starscape.bracketflow.common.domain.AggregateRoot;
import com.starscape.bracketflow.features.jobs.domain.events.JobFinished;
import com.starscape.bracketflow.features.jobs.domain.events.JobStatusChanged;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Objects;

/**
 * A batch of uploaded photos moving from upload through grouping, credit reservation
 * and external processing to a terminal outcome.
 * <p>
 * Unit counts are in capture groups; the ledger is charged {@code units * creditPerUnit}.
 * {@code reservedUnits} only ever reflects reservations the ledger has confirmed.
 */
@Entity
@Table(name = "jobs", indexes = @Index(name = "idx_jobs_user", columnList = "user_id"))
public class Job extends AggregateRoot<String> {

    @Id
    @Column(name = "job_id")
    private String jobId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "workflow_id", nullable = false)
    private String workflowId;

    @Column(name = "project_name")
    private String projectName;

    @Column(name = "credit_per_unit", nullable = false)
    private int creditPerUnit;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private JobStatus status;

    @Column(name = "estimated_units", nullable = false)
    private int estimatedUnits;

    @Column(name = "reserved_units", nullable = false)
    private int reservedUnits;

    @Column(name = "settled_units", nullable = false)
    private int settledUnits;

    @Column(name = "reservation_round", nullable = false)
    private int reservationRound;

    @Column(name = "input_type")
    private String inputType;

    @Column(name = "hdr_confidence")
    private Double hdrConfidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_mode", length = 16)
    private ProcessingMode processingMode;

    @Column(name = "manifest_key", length = 1024)
    private String manifestKey;

    @Column(name = "manifest_hash", length = 64)
    private String manifestHash;

    @Column(name = "execution_handle")
    private String executionHandle;

    @Column(name = "manifest_recorded_at")
    private Instant manifestRecordedAt;

    @Column(name = "dispatched_at")
    private Instant dispatchedAt;

    @Column(name = "last_event_sequence", nullable = false)
    private long lastEventSequence;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    protected Job() {
        // JPA constructor
    }

    public Job(String jobId, String userId, Workflow workflow, String projectName) {
        super(jobId);
        this.jobId = jobId;
        this.userId = userId;
        this.workflowId = workflow.getWorkflowId();
        this.creditPerUnit = workflow.getCreditPerUnit();
        this.maxAttempts = workflow.getMaxAttempts();
        this.projectName = projectName;
        this.status = JobStatus.DRAFT;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @Override
    public String getId() {
        return jobId;
    }

    public String getJobId() {
        return jobId;
    }

    public String getUserId() {
        return userId;
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId.equals(candidateUserId);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getProjectName() {
        return projectName;
    }

    public int getCreditPerUnit() {
        return creditPerUnit;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getEstimatedUnits() {
        return estimatedUnits;
    }

    public int getReservedUnits() {
        return reservedUnits;
    }

    public int getSettledUnits() {
        return settledUnits;
    }

    public int getReservationRound() {
        return reservationRound;
    }

    public String getInputType() {
        return inputType;
    }

    public Double getHdrConfidence() {
        return hdrConfidence;
    }

    public ProcessingMode getProcessingMode() {
        return processingMode;
    }

    public String getManifestKey() {
        return manifestKey;
    }

    public String getManifestHash() {
        return manifestHash;
    }

    public String getExecutionHandle() {
        return executionHandle;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public long getLastEventSequence() {
        return lastEventSequence;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    /**
     * Ledger amount for a number of units under this job's workflow price.
     */
    public long creditsFor(int units) {
        return (long) units * creditPerUnit;
    }

    /**
     * Allocates the next event sequence. Callers hold the job row lock.
     */
    public long nextEventSequence() {
        lastEventSequence++;
        return lastEventSequence;
    }

    // ---- upload and grouping

    public void recordUploads(long declared, long confirmed) {
        if (status != JobStatus.DRAFT && status != JobStatus.UPLOADING
                && status != JobStatus.GROUPING && status != JobStatus.INPUT_RESOLVED) {
            throw new IllegalStateException("Cannot register files for job in status " + status.wireValue());
        }
        this.estimatedUnits = 0;
        JobStatus next = declared > 0 && confirmed >= declared ? JobStatus.GROUPING : JobStatus.UPLOADING;
        transitionTo(next);
    }

    public void beginAnalysis() {
        if (!status.acceptsAnalysis()) {
            throw new IllegalStateException("Cannot analyze job in status " + status.wireValue());
        }
        transitionTo(JobStatus.ANALYZING);
    }

    /**
     * Grouping could not run to completion; the job waits for another analyze request.
     */
    public void abortAnalysis(String reason) {
        if (status == JobStatus.ANALYZING) {
            this.errorMessage = reason;
            transitionTo(JobStatus.GROUPING);
        }
    }

    public void resolveInput(int groupCount, String inputType, Double maxConfidence) {
        if (status != JobStatus.ANALYZING && status != JobStatus.GROUPING) {
            throw new IllegalStateException("Cannot resolve input for job in status " + status.wireValue());
        }
        if (reservedUnits != 0) {
            throw new IllegalStateException("Job " + jobId + " still holds a reservation");
        }
        this.estimatedUnits = groupCount;
        this.inputType = inputType;
        this.hdrConfidence = maxConfidence;
        this.errorMessage = null;
        transitionTo(JobStatus.INPUT_RESOLVED);
    }

    /**
     * Provider-side grouping was requested; the job waits in {@code grouping} for the result.
     */
    public void awaitRemoteGrouping() {
        if (status != JobStatus.INPUT_RESOLVED && status != JobStatus.GROUPING) {
            throw new IllegalStateException("Cannot request remote grouping in status " + status.wireValue());
        }
        transitionTo(JobStatus.GROUPING);
    }

    /**
     * The provider could not group the files; the job stays in {@code grouping}.
     */
    public void recordRemoteGroupingFailure(String reason) {
        this.errorMessage = reason;
        this.updatedAt = Instant.now();
    }

    // ---- reservation and dispatch

    /**
     * Enters {@code reserved} before a dispatch. {@code additionalUnits} were just confirmed
     * by the ledger (zero when an existing reservation is reused).
     */
    public void beginDispatch(int additionalUnits) {
        if (status != JobStatus.INPUT_RESOLVED && !status.isProcessing()) {
            throw new IllegalStateException("Cannot dispatch job in status " + status.wireValue());
        }
        if (additionalUnits < 0) {
            throw new IllegalArgumentException("additionalUnits must not be negative");
        }
        this.reservedUnits += additionalUnits;
        if (additionalUnits > 0) {
            this.reservationRound++;
        }
        this.errorMessage = null;
        transitionTo(JobStatus.RESERVED);
    }

    /**
     * Rolls back {@link #beginDispatch(int)} after the provider rejected the work.
     */
    public void revertDispatch(JobStatus previousStatus, int releasedUnits, String reason) {
        if (status != JobStatus.RESERVED) {
            throw new IllegalStateException("Cannot revert dispatch of job in status " + status.wireValue());
        }
        this.reservedUnits = Math.max(0, reservedUnits - releasedUnits);
        this.errorMessage = reason;
        transitionTo(previousStatus);
    }

    public void markDispatched() {
        if (status == JobStatus.RESERVED) {
            transitionTo(JobStatus.HDR_PROCESSING);
        }
    }

    /**
     * Moves forward through the processing stages reported by the provider. Never moves back.
     */
    public boolean advanceStage(JobStatus stage) {
        if (!stage.isStage() || !status.isStage() || stage.ordinal() <= status.ordinal()) {
            return false;
        }
        transitionTo(stage);
        return true;
    }

    public void recordManifest(String key, String hash, ProcessingMode mode) {
        this.manifestKey = key;
        this.manifestHash = hash;
        this.processingMode = mode;
        this.executionHandle = null;
        this.manifestRecordedAt = Instant.now();
        this.updatedAt = manifestRecordedAt;
    }

    /**
     * Stores the provider's handle if {@code hash} is still the current manifest.
     */
    public boolean recordExecution(String hash, String handle) {
        if (!Objects.equals(manifestHash, hash)) {
            return false;
        }
        this.executionHandle = handle;
        this.dispatchedAt = Instant.now();
        this.updatedAt = dispatchedAt;
        return true;
    }

    public void clearManifest(String hash) {
        if (Objects.equals(manifestHash, hash)) {
            this.manifestKey = null;
            this.manifestHash = null;
            this.executionHandle = null;
            this.manifestRecordedAt = null;
        }
    }

    /**
     * True when {@code hash} is already live with the provider and must not be sent again.
     */
    public boolean isDispatchLive(String hash) {
        return hash != null
            && hash.equals(manifestHash)
            && executionHandle != null
            && status.isDispatchInProgress();
    }

    /**
     * True when {@code hash} was recorded after {@code staleBefore} and its provider call has
     * not returned a handle yet.
     */
    public boolean isSubmissionPending(String hash, Instant staleBefore) {
        return hash != null
            && hash.equals(manifestHash)
            && executionHandle == null
            && manifestRecordedAt != null
            && manifestRecordedAt.isAfter(staleBefore)
            && status.isDispatchInProgress();
    }

    /**
     * A callback is current only if every identifier it carries matches the live dispatch.
     */
    public boolean matchesDispatch(String callbackManifestKey, String callbackHandle) {
        if (callbackManifestKey == null && callbackHandle == null) {
            return false;
        }
        if (callbackManifestKey != null && !callbackManifestKey.equals(manifestKey)) {
            return false;
        }
        return callbackHandle == null || callbackHandle.equals(executionHandle);
    }

    // ---- outcomes

    public void finish(int succeeded, int failed, int settled, String error) {
        if (status.isTerminal()) {
            return;
        }
        JobStatus outcome;
        if (failed == 0 && succeeded > 0) {
            outcome = JobStatus.COMPLETED;
        } else if (succeeded > 0) {
            outcome = JobStatus.PARTIAL;
        } else {
            outcome = JobStatus.FAILED;
        }
        this.settledUnits += settled;
        this.reservedUnits = 0;
        this.errorMessage = error;
        this.finishedAt = Instant.now();
        transitionTo(outcome);
        registerEvent(new JobFinished(jobId, outcome, succeeded, failed, error, finishedAt));
    }

    /**
     * Cancels the job. Returns the units whose reservation the caller must release,
     * or -1 when the job was already terminal and nothing happened.
     */
    public int cancel() {
        if (status.isTerminal()) {
            return -1;
        }
        int toRelease = reservedUnits;
        this.reservedUnits = 0;
        this.errorMessage = "Canceled by user";
        this.finishedAt = Instant.now();
        transitionTo(JobStatus.CANCELED);
        registerEvent(new JobFinished(jobId, JobStatus.CANCELED, 0, 0, errorMessage, finishedAt));
        return toRelease;
    }

    private void transitionTo(JobStatus next) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is already " + status.wireValue());
        }
        JobStatus previous = this.status;
        this.status = next;
        this.updatedAt = Instant.now();
        if (previous != next) {
            registerEvent(new JobStatusChanged(jobId, next, previous, updatedAt));
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
