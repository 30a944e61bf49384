package com.starscape.bracketflow.features.registerfiles.api.dto;

import com.starscape.bracketflow.features.metadata.domain.RawExifTags;

/**
 * Capture fields the client already read from the file, in their EXIF text form.
 */
public record ClientExifHints(
    String dateTimeOriginal,
    String createDate,
    String modifyDate,
    String offsetTime,
    String exposureTime,
    String shutterSpeed,
    String fNumber,
    String aperture,
    String iso,
    String focalLength,
    String make,
    String model
) {
    
    public RawExifTags toRawTags() {
        return new RawExifTags(dateTimeOriginal, createDate, modifyDate, offsetTime, exposureTime,
            shutterSpeed, fNumber, aperture, iso, focalLength, make, model);
    }
}
