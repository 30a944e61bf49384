package com.starscape.bracketflow.features.grouping.app;

import com.starscape.bracketflow.common.config.GroupingProperties;
import com.starscape.bracketflow.common.exception.NotFoundException;
import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.features.grouping.api.dto.AnalyzeJobResponse;
import com.starscape.bracketflow.features.grouping.api.dto.GroupSummary;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroup;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobStatus;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.metadata.app.MetadataExtractionService;
import com.starscape.bracketflow.features.metadata.domain.CaptureMetadata;
import com.starscape.bracketflow.features.metadata.domain.CaptureMetadataReader;
import com.starscape.bracketflow.features.dispatch.domain.ComputeProviderClient;
import com.starscape.bracketflow.support.JobBackendHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class AnalyzeJobHandlerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private JobBackendHarness harness;
    private AtomicInteger reads;
    private AnalyzeJobHandler handler;

    @BeforeEach
    void setUp() {
        harness = new JobBackendHarness(mock(ComputeProviderClient.class));
        reads = new AtomicInteger();
        // 0 / +1 / -1 bracket shot one second apart, f/8 ISO 100
        CaptureMetadataReader reader = storageKey -> {
            reads.incrementAndGet();
            if (storageKey.endsWith("IMG_1000.CR2")) {
                return exif(0, 1.0 / 128);
            }
            if (storageKey.endsWith("IMG_1001.CR2")) {
                return exif(1, 1.0 / 256);
            }
            if (storageKey.endsWith("IMG_1002.CR2")) {
                return exif(2, 1.0 / 64);
            }
            throw new IOException("No such object: " + storageKey);
        };
        GroupingProperties groupingProperties = new GroupingProperties();
        handler = new AnalyzeJobHandler(
            harness.jobLookup,
            harness.files,
            new MetadataExtractionService(reader, groupingProperties),
            new CaptureGroupWriter(harness.groups, harness.files),
            harness.eventBus,
            new JobLocks(),
            TransactionOperations.withoutTransaction(),
            groupingProperties);
    }

    @Test
    void handle_bracketedUpload_resolvesOneHdrGroup() {
        Job job = harness.uploadedJob(3, 3);

        AnalyzeJobResponse response = handler.handle(job.getJobId(), JobBackendHarness.USER_ID);

        assertThat(response.status()).isEqualTo("input_resolved");
        assertThat(response.totalFiles()).isEqualTo(3);
        assertThat(response.totalGroups()).isEqualTo(1);
        assertThat(response.hdrGroups()).isEqualTo(1);
        assertThat(response.inputType()).isEqualTo("hdr");
        GroupSummary group = response.groups().get(0);
        assertThat(group.outputFilename()).isEqualTo("IMG_1000.jpg");
        assertThat(group.frames()).containsExactly("IMG_1002.CR2", "IMG_1000.CR2", "IMG_1001.CR2");
        assertThat(group.representativeIndex()).isEqualTo(1);

        Job reloaded = harness.reload(job.getJobId());
        assertThat(reloaded.getStatus()).isEqualTo(JobStatus.INPUT_RESOLVED);
        assertThat(reloaded.getEstimatedUnits()).isEqualTo(1);
        assertThat(harness.files.findByJobIdOrderByCreatedAtAsc(job.getJobId()))
            .allSatisfy(file -> {
                assertThat(file.getGroupId()).isEqualTo(group.groupId());
                assertThat(file.getExposureValue()).isNotNull();
                assertThat(file.getMetadataExtractedAt()).isNotNull();
            });
        assertThat(harness.events.types(job.getJobId()))
            .contains("grouping_progress", "grouped")
            .endsWith("grouping_progress");
    }

    @Test
    void handle_again_replacesGroupsWithoutRereadingMetadata() {
        Job job = harness.uploadedJob(3, 3);
        String firstGroupId = handler.handle(job.getJobId(), JobBackendHarness.USER_ID).groups().get(0).groupId();

        AnalyzeJobResponse second = handler.handle(job.getJobId(), JobBackendHarness.USER_ID);

        assertThat(reads.get()).isEqualTo(3);
        assertThat(second.groups()).hasSize(1);
        List<CaptureGroup> stored = harness.groupsOf(job.getJobId());
        assertThat(stored).extracting(CaptureGroup::getGroupId)
            .containsExactly(second.groups().get(0).groupId())
            .doesNotContain(firstGroupId);
    }

    @Test
    void handle_someUnreadableOriginals_stillGroupsEveryFile() {
        Job job = harness.uploadedJob(5, 3);

        AnalyzeJobResponse response = handler.handle(job.getJobId(), JobBackendHarness.USER_ID);

        assertThat(response.totalFiles()).isEqualTo(5);
        assertThat(harness.files.findByJobIdOrderByCreatedAtAsc(job.getJobId()))
            .extracting(UploadedFile::getGroupId)
            .doesNotContainNull();
        assertThat(response.groups()).extracting(GroupSummary::size)
            .allSatisfy(size -> assertThat(size).isBetween(1, 7));
    }

    @Test
    void handle_noUploads_isRejectedAndStatusUnchanged() {
        Job job = harness.uploadedJob(0, 3);

        assertThatThrownBy(() -> handler.handle(job.getJobId(), JobBackendHarness.USER_ID))
            .isInstanceOf(ValidationException.class);
        assertThat(harness.reload(job.getJobId()).getStatus()).isEqualTo(JobStatus.UPLOADING);
    }

    @Test
    void handle_otherUsersJob_isNotFound() {
        Job job = harness.uploadedJob(3, 3);

        assertThatThrownBy(() -> handler.handle(job.getJobId(), "usr_intruder"))
            .isInstanceOf(NotFoundException.class);
    }

    private static CaptureMetadata exif(int secondsAfterStart, double exposureTime) {
        return new CaptureMetadata(T0.plusSeconds(secondsAfterStart), null, exposureTime, 8.0, 100, 24.0,
            "Canon", "EOS R5");
    }
}
