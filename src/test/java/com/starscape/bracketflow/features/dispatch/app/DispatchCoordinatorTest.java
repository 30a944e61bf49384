package com.starscape.bracketflow.features.dispatch.app;

import com.starscape.bracketflow.common.exception.ExternalDispatchException;
import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.features.dispatch.domain.ComputeProviderClient;
import com.starscape.bracketflow.features.dispatch.domain.ComputeProviderException;
import com.starscape.bracketflow.features.dispatch.domain.ComputeSubmission;
import com.starscape.bracketflow.features.dispatch.domain.DispatchResult;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.ProcessingMode;
import com.starscape.bracketflow.support.JobBackendHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.starscape.bracketflow.support.JobBackendHarness.USER_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DispatchCoordinatorTest {

    @Mock ComputeProviderClient provider;

    JobBackendHarness backend;
    DispatchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        backend = new JobBackendHarness(provider);
        coordinator = backend.coordinator;
        backend.deposit(100);
    }

    @Test
    void dispatch_recordsManifestAndExecution() {
        Job job = backend.resolvedJob(2, 3);
        when(provider.submit(any())).thenReturn("exec-1");

        DispatchResult result = coordinator.dispatch(job.getJobId(), ProcessingMode.FULL);

        assertThat(result.reused()).isFalse();
        assertThat(result.fileCount()).isEqualTo(2);
        assertThat(result.queuePending()).isEqualTo(1);
        assertThat(job.getManifestHash()).isEqualTo(result.manifestHash());
        assertThat(job.getExecutionHandle()).isEqualTo("exec-1");
        ArgumentCaptor<ComputeSubmission> submission = ArgumentCaptor.forClass(ComputeSubmission.class);
        verify(provider).submit(submission.capture());
        assertThat(submission.getValue().manifestKey()).isEqualTo(job.getManifestKey());
        assertThat(submission.getValue().callbackUrl()).isEqualTo("http://localhost/callbacks/compute");
        assertThat(submission.getValue().workflowId()).isEqualTo("wf_test");
    }

    @Test
    void dispatch_sameManifestWhileLive_reusesExecution() {
        Job job = backend.resolvedJob(2, 3);
        when(provider.submit(any())).thenReturn("exec-1");
        backend.lifecycle.start(job.getJobId(), USER_ID, null);

        DispatchResult again = coordinator.dispatch(job.getJobId(), ProcessingMode.FULL);

        assertThat(again.reused()).isTrue();
        assertThat(again.executionHandle()).isEqualTo("exec-1");
        verify(provider, times(1)).submit(any());
    }

    @Test
    void dispatch_sameManifestWhileSubmitting_isRejected() {
        Job job = backend.resolvedJob(2, 3);
        AtomicReference<Throwable> concurrentRequest = new AtomicReference<>();
        when(provider.submit(any())).thenAnswer(invocation -> {
            try {
                backend.lifecycle.requestRemoteGrouping(job.getJobId(), USER_ID);
            } catch (RuntimeException e) {
                concurrentRequest.set(e);
            }
            return "exec-1";
        });

        backend.lifecycle.requestRemoteGrouping(job.getJobId(), USER_ID);

        assertThat(concurrentRequest.get())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already being submitted");
        verify(provider, times(1)).submit(any());
        assertThat(job.getExecutionHandle()).isEqualTo("exec-1");
        assertThat(job.getProcessingMode()).isEqualTo(ProcessingMode.GROUP);
    }

    @Test
    void dispatch_afterSubmissionTimeout_submitsAgain() {
        Job job = backend.resolvedJob(2, 3);
        backend.dispatchProperties.setSubmissionTimeout(Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();
        when(provider.submit(any())).thenAnswer(invocation -> {
            if (calls.incrementAndGet() == 1) {
                backend.lifecycle.requestRemoteGrouping(job.getJobId(), USER_ID);
            }
            return "exec-" + calls.get();
        });

        backend.lifecycle.requestRemoteGrouping(job.getJobId(), USER_ID);

        verify(provider, times(2)).submit(any());
    }

    @Test
    void dispatch_providerFailure_clearsManifest() {
        Job job = backend.resolvedJob(2, 3);
        when(provider.submit(any())).thenThrow(new ComputeProviderException("503 from provider"));

        assertThatThrownBy(() -> coordinator.dispatch(job.getJobId(), ProcessingMode.FULL))
            .isInstanceOf(ExternalDispatchException.class)
            .hasMessageContaining("503 from provider");

        assertThat(job.getManifestHash()).isNull();
        assertThat(job.getManifestKey()).isNull();
        assertThat(backend.metrics.pending()).isZero();
    }

    @Test
    void dispatch_nothingToSend_isRejected() {
        Job job = backend.uploadedJob(2, 3);

        assertThatThrownBy(() -> coordinator.dispatch(job.getJobId(), ProcessingMode.FULL))
            .isInstanceOf(ValidationException.class);
        verifyNoInteractions(provider);
    }

    @Test
    void dispatch_groupMode_sendsEveryConfirmedUpload() {
        Job job = backend.uploadedJob(3, 3);
        when(provider.submit(any())).thenReturn("exec-group");

        DispatchResult result = coordinator.dispatch(job.getJobId(), ProcessingMode.GROUP);

        assertThat(result.fileCount()).isEqualTo(3);
        assertThat(job.getProcessingMode()).isEqualTo(ProcessingMode.GROUP);
    }
}
