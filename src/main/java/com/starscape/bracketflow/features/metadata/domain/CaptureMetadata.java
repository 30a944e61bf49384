package com.starscape.bracketflow.features.metadata.domain;

import java.time.Instant;

/**
 * Normalized capture metadata of one file. Every field is optional.
 *
 * @param exposureTime shutter time in seconds
 * @param exposureValue EV derived from shutter, aperture and ISO; null unless all three are positive
 */
public record CaptureMetadata(
    Instant captureTime,
    Double exposureValue,
    Double exposureTime,
    Double fNumber,
    Integer iso,
    Double focalLength,
    String cameraMake,
    String cameraModel
) {
    
    public static CaptureMetadata empty() {
        return new CaptureMetadata(null, null, null, null, null, null, null, null);
    }
    
    public boolean isComplete() {
        return captureTime != null && exposureTime != null && fNumber != null
            && iso != null && focalLength != null;
    }
    
    /**
     * Field-wise merge that keeps this record's values and fills gaps from {@code other}.
     */
    public CaptureMetadata orElse(CaptureMetadata other) {
        if (other == null) {
            return this;
        }
        return new CaptureMetadata(
            captureTime != null ? captureTime : other.captureTime,
            exposureValue != null ? exposureValue : other.exposureValue,
            exposureTime != null ? exposureTime : other.exposureTime,
            fNumber != null ? fNumber : other.fNumber,
            iso != null ? iso : other.iso,
            focalLength != null ? focalLength : other.focalLength,
            cameraMake != null ? cameraMake : other.cameraMake,
            cameraModel != null ? cameraModel : other.cameraModel
        );
    }
}
