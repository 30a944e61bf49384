package com.starscape.bracketflow.features.lifecycle.app;

import com.starscape.bracketflow.common.exception.ExternalDispatchException;
import com.starscape.bracketflow.common.exception.InsufficientCreditsException;
import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.features.credits.domain.CreditBalance;
import com.starscape.bracketflow.features.dispatch.domain.ComputeProviderClient;
import com.starscape.bracketflow.features.dispatch.domain.ComputeProviderException;
import com.starscape.bracketflow.features.dispatch.domain.ComputeSubmission;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroup;
import com.starscape.bracketflow.features.jobs.domain.GroupStatus;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobStatus;
import com.starscape.bracketflow.features.lifecycle.api.dto.JobActionResponse;
import com.starscape.bracketflow.support.JobBackendHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.starscape.bracketflow.support.JobBackendHarness.USER_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobLifecycleService over in-memory stores and a real ledger.
 * Only the compute provider is mocked.
 */
@ExtendWith(MockitoExtension.class)
class JobLifecycleServiceTest {

    @Mock ComputeProviderClient provider;

    JobBackendHarness backend;
    JobLifecycleService service;

    @BeforeEach
    void setUp() {
        backend = new JobBackendHarness(provider);
        service = backend.lifecycle;
        backend.deposit(100);
    }

    // ------------------------------------------------------------------
    // start()
    // ------------------------------------------------------------------

    @Test
    void start_happyPath_reservesAndDispatchesEveryGroup() {
        Job job = backend.resolvedJob(3, 3);
        when(provider.submit(any())).thenReturn("exec-1");

        JobActionResponse response = service.start(job.getJobId(), USER_ID, null);

        assertThat(response.status()).isEqualTo("hdr_processing");
        assertThat(response.reservedUnits()).isEqualTo(3);
        assertThat(response.executionHandle()).isEqualTo("exec-1");
        assertThat(response.dispatchReused()).isFalse();
        assertThat(response.changed()).isTrue();
        assertThat(backend.groupsOf(job.getJobId()))
            .extracting(CaptureGroup::getStatus)
            .containsOnly(GroupStatus.PROCESSING);
        // 3 units at 2 credits each
        CreditBalance balance = backend.balance();
        assertThat(balance.available()).isEqualTo(94);
        assertThat(balance.reserved()).isEqualTo(6);
        assertThat(backend.events.types(job.getJobId())).contains("dispatch_started", "group_status_changed");
    }

    @Test
    void start_calledTwice_secondCallIsNoop() {
        Job job = backend.resolvedJob(3, 3);
        when(provider.submit(any())).thenReturn("exec-1");

        service.start(job.getJobId(), USER_ID, null);
        JobActionResponse again = service.start(job.getJobId(), USER_ID, null);

        assertThat(again.changed()).isFalse();
        assertThat(again.executionHandle()).isEqualTo("exec-1");
        verify(provider, times(1)).submit(any());
        assertThat(backend.balance().reserved()).isEqualTo(6);
    }

    @Test
    void start_withSkippedGroup_reservesOnlyActiveGroups() {
        Job job = backend.resolvedJob(3, 3);
        String skipped = job.getJobId() + "_grp1";
        when(provider.submit(any())).thenReturn("exec-1");

        JobActionResponse response = service.start(job.getJobId(), USER_ID, List.of(skipped));

        assertThat(response.activeGroups()).isEqualTo(2);
        assertThat(response.skippedGroups()).isEqualTo(1);
        assertThat(response.reservedUnits()).isEqualTo(2);
        assertThat(backend.balance().reserved()).isEqualTo(4);
        ArgumentCaptor<ComputeSubmission> submission = ArgumentCaptor.forClass(ComputeSubmission.class);
        verify(provider).submit(submission.capture());
        assertThat(submission.getValue().fileCount()).isEqualTo(2);
        assertThat(submission.getValue().mode()).isEqualTo("full");
        assertThat(backend.groupsOf(job.getJobId()).get(1).getStatus()).isEqualTo(GroupStatus.SKIPPED);
    }

    @Test
    void start_skippingEveryGroup_isRejected() {
        Job job = backend.resolvedJob(2, 3);

        assertThatThrownBy(() -> service.start(job.getJobId(), USER_ID,
                List.of(job.getJobId() + "_grp0", job.getJobId() + "_grp1")))
            .isInstanceOf(ValidationException.class);
        verifyNoInteractions(provider);
    }

    @Test
    void start_unknownSkipId_isRejected() {
        Job job = backend.resolvedJob(2, 3);

        assertThatThrownBy(() -> service.start(job.getJobId(), USER_ID, List.of("grp_elsewhere")))
            .isInstanceOf(ValidationException.class);
        verifyNoInteractions(provider);
    }

    @Test
    void start_insufficientCredits_leavesJobResolved() {
        Job job = backend.resolvedJob(60, 3);

        assertThatThrownBy(() -> service.start(job.getJobId(), USER_ID, null))
            .isInstanceOf(InsufficientCreditsException.class);

        Job reloaded = backend.reload(job.getJobId());
        assertThat(reloaded.getStatus()).isEqualTo(JobStatus.INPUT_RESOLVED);
        assertThat(reloaded.getReservedUnits()).isZero();
        assertThat(backend.balance().available()).isEqualTo(100);
        verifyNoInteractions(provider);
    }

    @Test
    void start_beforeGrouping_isConflict() {
        Job job = backend.uploadedJob(2, 3);

        assertThatThrownBy(() -> service.start(job.getJobId(), USER_ID, null))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void start_providerRejects_releasesCreditsAndRevertsJob() {
        Job job = backend.resolvedJob(3, 3);
        when(provider.submit(any()))
            .thenThrow(new ComputeProviderException("provider down"))
            .thenReturn("exec-2");

        assertThatThrownBy(() -> service.start(job.getJobId(), USER_ID, null))
            .isInstanceOf(ExternalDispatchException.class);

        Job reverted = backend.reload(job.getJobId());
        assertThat(reverted.getStatus()).isEqualTo(JobStatus.INPUT_RESOLVED);
        assertThat(reverted.getReservedUnits()).isZero();
        assertThat(reverted.getManifestHash()).isNull();
        assertThat(reverted.getErrorMessage()).contains("provider down");
        assertThat(backend.balance().available()).isEqualTo(100);
        assertThat(backend.balance().reserved()).isZero();
        assertThat(backend.groupsOf(job.getJobId())).extracting(CaptureGroup::getStatus)
            .containsOnly(GroupStatus.QUEUED);

        // a later start takes a fresh reservation instead of reusing the released one
        JobActionResponse retried = service.start(job.getJobId(), USER_ID, null);

        assertThat(retried.executionHandle()).isEqualTo("exec-2");
        assertThat(backend.balance().reserved()).isEqualTo(6);
        assertThat(backend.balance().available()).isEqualTo(94);
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_afterStart_releasesReservationOnce() {
        Job job = backend.resolvedJob(3, 3);
        when(provider.submit(any())).thenReturn("exec-1");
        service.start(job.getJobId(), USER_ID, null);

        JobActionResponse first = service.cancel(job.getJobId(), USER_ID);
        JobActionResponse second = service.cancel(job.getJobId(), USER_ID);

        assertThat(first.changed()).isTrue();
        assertThat(first.status()).isEqualTo("canceled");
        assertThat(second.changed()).isFalse();
        assertThat(backend.balance().available()).isEqualTo(100);
        assertThat(backend.balance().reserved()).isZero();
        assertThat(backend.groupsOf(job.getJobId())).allSatisfy(group -> {
            assertThat(group.getStatus()).isEqualTo(GroupStatus.FAILED);
            assertThat(group.getLastError()).isEqualTo(JobLifecycleService.CANCELED_REASON);
        });
        assertThat(backend.events.types(job.getJobId())).containsOnlyOnce("job_done");
    }

    @Test
    void cancel_beforeStart_touchesNoCredits() {
        Job job = backend.resolvedJob(2, 3);

        JobActionResponse response = service.cancel(job.getJobId(), USER_ID);

        assertThat(response.status()).isEqualTo("canceled");
        assertThat(backend.balance().available()).isEqualTo(100);
        verifyNoInteractions(provider);
    }

    // ------------------------------------------------------------------
    // retryMissing()
    // ------------------------------------------------------------------

    @Test
    void retryMissing_requeuesFailedGroupsUnderExistingReservation() {
        Job job = backend.resolvedJob(3, 3);
        when(provider.submit(any())).thenReturn("exec-1", "exec-2");
        service.start(job.getJobId(), USER_ID, null);
        List<CaptureGroup> groups = backend.groupsOf(job.getJobId());
        groups.get(0).markSucceeded("results/0.jpg");
        groups.get(1).markFailed("decode error");

        JobActionResponse response = service.retryMissing(job.getJobId(), USER_ID);

        assertThat(response.executionHandle()).isEqualTo("exec-2");
        assertThat(response.status()).isEqualTo("hdr_processing");
        CaptureGroup retried = backend.groupsOf(job.getJobId()).get(1);
        assertThat(retried.getStatus()).isEqualTo(GroupStatus.PROCESSING);
        assertThat(retried.getAttempts()).isEqualTo(1);
        assertThat(backend.balance().reserved()).isEqualTo(6);
        // only the retried and still running groups are sent
        ArgumentCaptor<ComputeSubmission> submissions = ArgumentCaptor.forClass(ComputeSubmission.class);
        verify(provider, times(2)).submit(submissions.capture());
        assertThat(submissions.getAllValues().get(1).fileCount()).isEqualTo(2);
    }

    @Test
    void retryMissing_nothingFailed_isConflict() {
        Job job = backend.resolvedJob(2, 3);
        when(provider.submit(any())).thenReturn("exec-1");
        service.start(job.getJobId(), USER_ID, null);

        assertThatThrownBy(() -> service.retryMissing(job.getJobId(), USER_ID))
            .isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // completeRun()
    // ------------------------------------------------------------------

    @Test
    void completeRun_partialOutcome_settlesSucceededAndReleasesRest() {
        Job job = backend.resolvedJob(3, 1);
        when(provider.submit(any())).thenReturn("exec-1");
        service.start(job.getJobId(), USER_ID, null);
        List<CaptureGroup> groups = backend.groupsOf(job.getJobId());
        groups.get(0).markSucceeded("results/0.jpg");
        groups.get(1).markSucceeded("results/1.jpg");
        groups.get(2).markFailed("gpu out of memory");

        Job locked = backend.reload(job.getJobId());
        service.completeRun(locked, groups, null);

        assertThat(locked.getStatus()).isEqualTo(JobStatus.PARTIAL);
        assertThat(locked.getSettledUnits()).isEqualTo(2);
        assertThat(locked.getReservedUnits()).isZero();
        assertThat(locked.getErrorMessage()).isEqualTo("1 of 3 groups failed");
        CreditBalance balance = backend.balance();
        assertThat(balance.spent()).isEqualTo(4);
        assertThat(balance.reserved()).isZero();
        assertThat(balance.available()).isEqualTo(96);
    }

    @Test
    void completeRun_everythingFailed_releasesWholeReservation() {
        Job job = backend.resolvedJob(2, 1);
        when(provider.submit(any())).thenReturn("exec-1");
        service.start(job.getJobId(), USER_ID, null);
        List<CaptureGroup> groups = backend.groupsOf(job.getJobId());
        groups.forEach(group -> group.markFailed("bad input"));

        Job locked = backend.reload(job.getJobId());
        service.completeRun(locked, groups, "workflow crashed");

        assertThat(locked.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(locked.getErrorMessage()).isEqualTo("workflow crashed");
        assertThat(backend.balance().spent()).isZero();
        assertThat(backend.balance().available()).isEqualTo(100);
    }
}
