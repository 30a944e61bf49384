package com.starscape.bracketflow.features.jobs.domain;

import com.starscape.bracketflow.common.domain.DomainEvent;
import com.starscape.bracketflow.features.jobs.domain.events.JobFinished;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTest {

    private Job job;

    @BeforeEach
    void setUp() {
        job = new Job("job_1", "usr_1", new Workflow("wf_1", "hdr", "HDR", 2, 3), "Kitchen");
    }

    // ------------------------------------------------------------------
    // upload and grouping
    // ------------------------------------------------------------------

    @Test
    void newJob_startsAsDraftWithWorkflowPrice() {
        assertThat(job.getStatus()).isEqualTo(JobStatus.DRAFT);
        assertThat(job.creditsFor(5)).isEqualTo(10);
        assertThat(job.getMaxAttempts()).isEqualTo(3);
        assertThat(job.isOwnedBy("usr_1")).isTrue();
        assertThat(job.isOwnedBy("usr_2")).isFalse();
    }

    @Test
    void recordUploads_movesToGroupingOnlyWhenAllConfirmed() {
        job.recordUploads(3, 1);
        assertThat(job.getStatus()).isEqualTo(JobStatus.UPLOADING);

        job.recordUploads(3, 3);
        assertThat(job.getStatus()).isEqualTo(JobStatus.GROUPING);
        assertThat(job.getDomainEvents()).hasSize(2);
    }

    @Test
    void resolveInput_recordsEstimate() {
        job.recordUploads(2, 2);
        job.beginAnalysis();

        job.resolveInput(4, "hdr", 0.91);

        assertThat(job.getStatus()).isEqualTo(JobStatus.INPUT_RESOLVED);
        assertThat(job.getEstimatedUnits()).isEqualTo(4);
        assertThat(job.getHdrConfidence()).isEqualTo(0.91);
    }

    @Test
    void abortAnalysis_returnsToGrouping() {
        job.recordUploads(2, 2);
        job.beginAnalysis();

        job.abortAnalysis("metadata unreadable");

        assertThat(job.getStatus()).isEqualTo(JobStatus.GROUPING);
        assertThat(job.getErrorMessage()).isEqualTo("metadata unreadable");
    }

    @Test
    void beginAnalysis_fromDraft_isRejected() {
        assertThatThrownBy(job::beginAnalysis).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // dispatch
    // ------------------------------------------------------------------

    @Test
    void beginDispatch_countsRoundsOnlyForNewUnits() {
        resolved(3);

        job.beginDispatch(3);
        assertThat(job.getReservationRound()).isEqualTo(1);
        job.markDispatched();
        job.beginDispatch(0);

        assertThat(job.getReservationRound()).isEqualTo(1);
        assertThat(job.getReservedUnits()).isEqualTo(3);
        assertThat(job.getStatus()).isEqualTo(JobStatus.RESERVED);
    }

    @Test
    void revertDispatch_restoresPreviousStatus() {
        resolved(3);
        job.beginDispatch(3);

        job.revertDispatch(JobStatus.INPUT_RESOLVED, 3, "provider down");

        assertThat(job.getStatus()).isEqualTo(JobStatus.INPUT_RESOLVED);
        assertThat(job.getReservedUnits()).isZero();
        assertThat(job.getErrorMessage()).isEqualTo("provider down");
    }

    @Test
    void dispatchIdentity_matchesOnlyCurrentManifest() {
        resolved(2);
        job.beginDispatch(2);
        job.recordManifest("m/job_1/abc.json", "abc", ProcessingMode.FULL);

        assertThat(job.recordExecution("old", "exec-0")).isFalse();
        assertThat(job.recordExecution("abc", "exec-1")).isTrue();

        assertThat(job.isDispatchLive("abc")).isTrue();
        assertThat(job.isDispatchLive("def")).isFalse();
        assertThat(job.matchesDispatch("m/job_1/abc.json", "exec-1")).isTrue();
        assertThat(job.matchesDispatch("m/job_1/abc.json", null)).isTrue();
        assertThat(job.matchesDispatch(null, "exec-1")).isTrue();
        assertThat(job.matchesDispatch("m/job_1/abc.json", "exec-0")).isFalse();
        assertThat(job.matchesDispatch(null, null)).isFalse();

        job.clearManifest("other");
        assertThat(job.getManifestHash()).isEqualTo("abc");
        job.clearManifest("abc");
        assertThat(job.getExecutionHandle()).isNull();
        assertThat(job.isDispatchLive("abc")).isFalse();
    }

    @Test
    void submissionPending_untilHandleRecordedOrStale() {
        resolved(2);
        job.beginDispatch(2);
        job.recordManifest("m/job_1/abc.json", "abc", ProcessingMode.FULL);
        Instant hourAgo = Instant.now().minusSeconds(3600);

        assertThat(job.isSubmissionPending("abc", hourAgo)).isTrue();
        assertThat(job.isSubmissionPending("def", hourAgo)).isFalse();
        assertThat(job.isSubmissionPending("abc", Instant.now().plusSeconds(1))).isFalse();

        job.recordExecution("abc", "exec-1");
        assertThat(job.isSubmissionPending("abc", hourAgo)).isFalse();
        assertThat(job.isDispatchLive("abc")).isTrue();
    }

    @Test
    void advanceStage_neverMovesBackwards() {
        resolved(1);
        job.beginDispatch(1);
        assertThat(job.advanceStage(JobStatus.AI_PROCESSING)).isFalse();
        job.markDispatched();

        assertThat(job.advanceStage(JobStatus.AI_PROCESSING)).isTrue();
        assertThat(job.advanceStage(JobStatus.WORKFLOW_RUNNING)).isFalse();
        assertThat(job.advanceStage(JobStatus.COMPLETED)).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.AI_PROCESSING);
    }

    // ------------------------------------------------------------------
    // outcomes
    // ------------------------------------------------------------------

    @Test
    void finish_picksOutcomeFromCounts() {
        assertThat(finished(3, 0)).isEqualTo(JobStatus.COMPLETED);
        assertThat(finished(2, 1)).isEqualTo(JobStatus.PARTIAL);
        assertThat(finished(0, 3)).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void cancel_releasesReservationOnce() {
        resolved(4);
        job.beginDispatch(4);

        assertThat(job.cancel()).isEqualTo(4);
        assertThat(job.cancel()).isEqualTo(-1);
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELED);
        assertThat(job.getDomainEvents())
            .extracting(DomainEvent::getEventType)
            .filteredOn(JobFinished.TYPE::equals)
            .hasSize(1);
    }

    @Test
    void terminalJob_rejectsFurtherTransitions() {
        job.cancel();

        assertThatThrownBy(() -> job.recordUploads(1, 1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> job.beginDispatch(1)).isInstanceOf(IllegalStateException.class);
    }

    private void resolved(int groups) {
        job.recordUploads(groups, groups);
        job.beginAnalysis();
        job.resolveInput(groups, "raw", null);
    }

    private JobStatus finished(int succeeded, int failed) {
        setUp();
        resolved(succeeded + failed);
        job.beginDispatch(succeeded + failed);
        job.markDispatched();
        job.finish(succeeded, failed, succeeded, null);
        return job.getStatus();
    }
}
