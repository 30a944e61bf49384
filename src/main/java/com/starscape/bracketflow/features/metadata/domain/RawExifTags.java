package com.starscape.bracketflow.features.metadata.domain;

/**
 * Unparsed EXIF values as read from a file or supplied by a client. Values keep
 * their source form ("1/250", "f/8", "2024:05:01 10:00:00") until normalized.
 */
public record RawExifTags(
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
    
    public static RawExifTags empty() {
        return new RawExifTags(null, null, null, null, null, null, null, null, null, null, null, null);
    }
}
