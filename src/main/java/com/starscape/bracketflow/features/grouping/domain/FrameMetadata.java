package com.starscape.bracketflow.features.grouping.domain;

import com.starscape.bracketflow.features.jobs.domain.FileKind;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.metadata.domain.SequenceToken;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * Immutable view of one file as seen by the grouping engine.
 */
public record FrameMetadata(
    String fileId,
    String storageKey,
    String filename,
    FileKind kind,
    Instant captureTime,
    Double exposureValue,
    Double exposureTime,
    Double fNumber,
    Integer iso,
    Double focalLength,
    String cameraMake,
    String cameraModel,
    SequenceToken sequence
) {
    
    public static FrameMetadata from(UploadedFile file) {
        return new FrameMetadata(
            file.getFileId(),
            file.getStorageKey(),
            file.getFilename(),
            file.getKind(),
            file.getCaptureTime(),
            file.getExposureValue(),
            file.getExposureTime(),
            file.getFNumber(),
            file.getIso(),
            file.getFocalLength(),
            file.getCameraMake(),
            file.getCameraModel(),
            file.getSequenceToken().orElse(null)
        );
    }
    
    /**
     * Exposure on a single scale for a set of frames: the EV when any frame has one,
     * otherwise {@link #shutterStops()}. Frames without a value on that scale map to null.
     */
    public static Function<FrameMetadata, Double> exposureScale(List<FrameMetadata> frames) {
        if (frames.stream().anyMatch(FrameMetadata::hasExposureValue)) {
            return frame -> frame.hasExposureValue() ? frame.exposureValue() : null;
        }
        return FrameMetadata::shutterStops;
    }
    
    public boolean hasExposureValue() {
        return exposureValue != null && Double.isFinite(exposureValue);
    }
    
    /**
     * {@code -log2(t)}: grows as the shutter shortens, like EV does.
     */
    public Double shutterStops() {
        if (exposureTime == null || exposureTime <= 0) {
            return null;
        }
        return -Math.log(exposureTime) / Math.log(2);
    }
    
    public Long captureMillis() {
        return captureTime == null ? null : captureTime.toEpochMilli();
    }
}
