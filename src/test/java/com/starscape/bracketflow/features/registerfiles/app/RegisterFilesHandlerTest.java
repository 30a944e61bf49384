package com.starscape.bracketflow.features.registerfiles.app;

import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.features.dispatch.domain.ComputeProviderClient;
import com.starscape.bracketflow.features.jobs.app.StorageLayout;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobStatus;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.jobs.domain.Workflow;
import com.starscape.bracketflow.features.registerfiles.api.dto.ClientExifHints;
import com.starscape.bracketflow.features.registerfiles.api.dto.FileRegistration;
import com.starscape.bracketflow.features.registerfiles.api.dto.RegisterFilesRequest;
import com.starscape.bracketflow.features.registerfiles.api.dto.RegisterFilesResponse;
import com.starscape.bracketflow.support.JobBackendHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.starscape.bracketflow.support.JobBackendHarness.USER_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class RegisterFilesHandlerTest {

    private JobBackendHarness harness;
    private RegisterFilesHandler handler;
    private String jobId;
    private String prefix;

    @BeforeEach
    void setUp() {
        harness = new JobBackendHarness(mock(ComputeProviderClient.class));
        StorageLayout storageLayout = new StorageLayout("test");
        handler = new RegisterFilesHandler(harness.jobLookup, harness.files, storageLayout, harness.eventBus);
        Job job = harness.jobs.save(new Job("job_reg", USER_ID, new Workflow("wf_1", "hdr", "HDR", 1, 3), null));
        jobId = job.getJobId();
        prefix = storageLayout.uploadPrefix(USER_ID, jobId);
    }

    @Test
    void handle_partialConfirmation_keepsJobUploading() {
        RegisterFilesResponse response = handler.handle(jobId, USER_ID, request(
            file("IMG_0001.CR2", true),
            file("IMG_0002.CR2", false)));

        assertThat(response.status()).isEqualTo("uploading");
        assertThat(response.declared()).isEqualTo(2);
        assertThat(response.confirmed()).isEqualTo(1);
        assertThat(response.files()).extracting(f -> f.kind()).containsOnly("raw");
        assertThat(harness.events.types(jobId)).containsExactly("job_status_changed", "files_registered");
    }

    @Test
    void handle_sameKeyAgain_confirmsExistingFile() {
        handler.handle(jobId, USER_ID, request(file("IMG_0001.CR2", false)));
        String fileId = harness.files.findByJobIdOrderByCreatedAtAsc(jobId).get(0).getFileId();

        RegisterFilesResponse response = handler.handle(jobId, USER_ID, request(file("IMG_0001.CR2", true)));

        assertThat(response.declared()).isEqualTo(1);
        assertThat(response.files().get(0).fileId()).isEqualTo(fileId);
        assertThat(harness.reload(jobId).getStatus()).isEqualTo(JobStatus.GROUPING);
    }

    @Test
    void handle_clientExif_isNormalizedOntoFile() {
        ClientExifHints hints = new ClientExifHints("2024:05:01 10:00:00", null, null, "+02:00",
            "1/125", null, "f/8", null, "100", "24 mm", "Canon", "EOS R5");
        FileRegistration registration = new FileRegistration(prefix + "IMG_0001.CR2", "IMG_0001.CR2", 10L, true, hints);

        handler.handle(jobId, USER_ID, new RegisterFilesRequest(List.of(registration)));

        UploadedFile stored = harness.files.findByJobIdOrderByCreatedAtAsc(jobId).get(0);
        assertThat(stored.getCaptureTime()).isEqualTo(Instant.parse("2024-05-01T08:00:00Z"));
        assertThat(stored.getIso()).isEqualTo(100);
        assertThat(stored.getFNumber()).isEqualTo(8.0);
        assertThat(stored.getExposureValue()).isNotNull();
        assertThat(stored.getCameraModel()).isEqualTo("EOS R5");
    }

    @Test
    void handle_keyOutsideUploadPrefix_isRejected() {
        FileRegistration foreign = new FileRegistration("test/usr_other/jobs/" + jobId + "/raw/IMG_0001.CR2",
            "IMG_0001.CR2", 10L, true, null);
        FileRegistration traversal = new FileRegistration(prefix + "../../secret.CR2", "secret.CR2", 10L, true, null);

        assertThatThrownBy(() -> handler.handle(jobId, USER_ID, new RegisterFilesRequest(List.of(foreign))))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> handler.handle(jobId, USER_ID, new RegisterFilesRequest(List.of(traversal))))
            .isInstanceOf(ValidationException.class);
        assertThat(harness.files.findByJobIdOrderByCreatedAtAsc(jobId)).isEmpty();
    }

    @Test
    void handle_duplicateKeyInOneRequest_isRejected() {
        assertThatThrownBy(() -> handler.handle(jobId, USER_ID, request(
            file("IMG_0001.CR2", true),
            file("IMG_0001.CR2", true))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("more than once");
    }

    @Test
    void sanitizeFilename_keepsLastSegment() {
        assertThat(RegisterFilesHandler.sanitizeFilename("C:\\shoots\\IMG_0001.CR2")).isEqualTo("IMG_0001.CR2");
        assertThat(RegisterFilesHandler.sanitizeFilename("a/b/IMG\u0007_2.jpg")).isEqualTo("IMG_2.jpg");
        assertThat(RegisterFilesHandler.sanitizeFilename("folder/")).isEqualTo("image");
    }

    private FileRegistration file(String name, boolean uploaded) {
        return new FileRegistration(prefix + name, name, 1024L, uploaded, null);
    }

    private static RegisterFilesRequest request(FileRegistration... files) {
        return new RegisterFilesRequest(List.of(files));
    }
}
