package com.starscape.bracketflow.features.jobs.domain;

import com.starscape.bracketflow.features.metadata.domain.CaptureMetadata;
import com.starscape.bracketflow.features.metadata.domain.MetadataNormalizer;
import com.starscape.bracketflow.features.metadata.domain.SequenceToken;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Optional;

@Entity
@Table(name = "uploaded_files",
    uniqueConstraints = @UniqueConstraint(name = "uq_uploaded_files_job_key", columnNames = {"job_id", "storage_key"}),
    indexes = @Index(name = "idx_uploaded_files_job", columnList = "job_id"))
public class UploadedFile {

    @Id
    @Column(name = "file_id")
    private String fileId;

    @Column(name = "job_id", nullable = false)
    private String jobId;

    @Column(name = "storage_key", nullable = false, length = 1024)
    private String storageKey;

    @Column(nullable = false)
    private String filename;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileKind kind;

    @Column
    private Long bytes;

    @Column(name = "upload_confirmed", nullable = false)
    private boolean uploadConfirmed;

    @Column(name = "capture_time")
    private Instant captureTime;

    @Column(name = "exposure_value")
    private Double exposureValue;

    @Column(name = "exposure_time")
    private Double exposureTime;

    @Column(name = "f_number")
    private Double fNumber;

    @Column
    private Integer iso;

    @Column(name = "focal_length")
    private Double focalLength;

    @Column(name = "camera_make")
    private String cameraMake;

    @Column(name = "camera_model")
    private String cameraModel;

    @Column(name = "sequence_prefix")
    private String sequencePrefix;

    @Column(name = "sequence_number")
    private Long sequenceNumber;

    @Column(name = "sequence_pad")
    private Integer sequencePad;

    @Column(name = "metadata_extracted_at")
    private Instant metadataExtractedAt;

    @Column(name = "group_id")
    private String groupId;

    @Column(name = "group_order")
    private Integer groupOrder;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected UploadedFile() {
        // JPA constructor
    }

    public UploadedFile(String fileId, String jobId, String storageKey, String filename, Long bytes) {
        this.fileId = fileId;
        this.jobId = jobId;
        this.storageKey = storageKey;
        this.filename = filename;
        this.kind = FileKind.fromFilename(filename);
        this.bytes = bytes;
        SequenceToken.parse(filename).ifPresent(token -> {
            this.sequencePrefix = token.prefix();
            this.sequenceNumber = token.number();
            this.sequencePad = token.padWidth();
        });
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public String getFileId() {
        return fileId;
    }

    public String getJobId() {
        return jobId;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public String getFilename() {
        return filename;
    }

    public FileKind getKind() {
        return kind;
    }

    public Long getBytes() {
        return bytes;
    }

    public boolean isUploadConfirmed() {
        return uploadConfirmed;
    }

    public Instant getCaptureTime() {
        return captureTime;
    }

    public Double getExposureValue() {
        return exposureValue;
    }

    public Double getExposureTime() {
        return exposureTime;
    }

    public Double getFNumber() {
        return fNumber;
    }

    public Integer getIso() {
        return iso;
    }

    public Double getFocalLength() {
        return focalLength;
    }

    public String getCameraMake() {
        return cameraMake;
    }

    public String getCameraModel() {
        return cameraModel;
    }

    public Optional<SequenceToken> getSequenceToken() {
        if (sequencePrefix == null || sequenceNumber == null) {
            return Optional.empty();
        }
        return Optional.of(new SequenceToken(sequencePrefix, sequenceNumber, sequencePad == null ? 0 : sequencePad));
    }

    public Instant getMetadataExtractedAt() {
        return metadataExtractedAt;
    }

    public String getGroupId() {
        return groupId;
    }

    public Integer getGroupOrder() {
        return groupOrder;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public CaptureMetadata getCaptureMetadata() {
        return new CaptureMetadata(captureTime, exposureValue, exposureTime, fNumber, iso,
            focalLength, cameraMake, cameraModel);
    }

    public void confirmUpload() {
        this.uploadConfirmed = true;
        this.updatedAt = Instant.now();
    }

    /**
     * Candidate files still missing capture fields that have never been read from storage.
     */
    public boolean needsMetadataExtraction() {
        return kind.isBracketCandidate()
            && metadataExtractedAt == null
            && !getCaptureMetadata().isComplete();
    }

    /**
     * Fills missing capture fields from {@code extracted}. Values already present win,
     * so applying the same metadata twice changes nothing.
     */
    public void applyMetadata(CaptureMetadata extracted) {
        CaptureMetadata merged = getCaptureMetadata().orElse(extracted);
        this.captureTime = merged.captureTime();
        this.exposureTime = merged.exposureTime();
        this.fNumber = merged.fNumber();
        this.iso = merged.iso();
        this.focalLength = merged.focalLength();
        this.cameraMake = merged.cameraMake();
        this.cameraModel = merged.cameraModel();
        if (this.exposureValue == null) {
            Double derived = MetadataNormalizer.exposureValue(exposureTime, fNumber, iso);
            this.exposureValue = derived != null ? derived : merged.exposureValue();
        }
        this.updatedAt = Instant.now();
    }

    public void markMetadataExtracted() {
        if (metadataExtractedAt == null) {
            this.metadataExtractedAt = Instant.now();
            this.updatedAt = metadataExtractedAt;
        }
    }

    public void assignToGroup(String groupId, int order) {
        this.groupId = groupId;
        this.groupOrder = order;
        this.updatedAt = Instant.now();
    }

    public void clearGroup() {
        this.groupId = null;
        this.groupOrder = null;
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
