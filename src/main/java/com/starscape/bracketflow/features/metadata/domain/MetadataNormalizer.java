package com.starscape.bracketflow.features.metadata.domain;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns heterogeneous EXIF values into {@link CaptureMetadata}.
 * <p>
 * Capture time falls back from DateTimeOriginal to CreateDate to ModifyDate and is
 * interpreted as UTC unless an offset is present. Exposure time falls back to the
 * shutter speed, f-number to the aperture. Unparseable values become null; nothing
 * here throws for bad input.
 */
public final class MetadataNormalizer {

    private static final Pattern NUMBER_OR_FRACTION =
        Pattern.compile("^([+-]?\\d+(?:\\.\\d+)?)(?:\\s*/\\s*(\\d+(?:\\.\\d+)?))?");

    private static final DateTimeFormatter EXIF_DATE_TIME = new DateTimeFormatterBuilder()
        .appendPattern("uuuu[:][-]MM[:][-]dd[ ]['T']HH:mm:ss")
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
        .optionalEnd()
        .toFormatter(Locale.ROOT);

    private static final Pattern TRAILING_OFFSET = Pattern.compile("^(.*?)(Z|[+-]\\d{2}:?\\d{2})$");

    private MetadataNormalizer() {
    }

    public static CaptureMetadata normalize(RawExifTags tags) {
        if (tags == null) {
            return CaptureMetadata.empty();
        }
        Instant captureTime = firstTime(tags.offsetTime(), tags.dateTimeOriginal(), tags.createDate(), tags.modifyDate());
        Double exposureTime = positive(parseNumber(tags.exposureTime()));
        if (exposureTime == null) {
            exposureTime = positive(parseNumber(tags.shutterSpeed()));
        }
        Double fNumber = positive(parseNumber(tags.fNumber()));
        if (fNumber == null) {
            fNumber = positive(parseNumber(tags.aperture()));
        }
        Double isoValue = positive(parseNumber(tags.iso()));
        Integer iso = isoValue == null ? null : (int) Math.round(isoValue);
        Double focalLength = positive(parseNumber(tags.focalLength()));

        return new CaptureMetadata(
            captureTime,
            exposureValue(exposureTime, fNumber, iso),
            exposureTime,
            fNumber,
            iso,
            focalLength,
            cleanText(tags.make()),
            cleanText(tags.model())
        );
    }

    /**
     * {@code log2(f^2 / t) - log2(iso / 100)}, or null unless all inputs are positive.
     */
    public static Double exposureValue(Double exposureTime, Double fNumber, Integer iso) {
        if (exposureTime == null || fNumber == null || iso == null) {
            return null;
        }
        if (exposureTime <= 0 || fNumber <= 0 || iso <= 0) {
            return null;
        }
        double ev = log2(fNumber * fNumber / exposureTime) - log2(iso / 100.0);
        return Double.isFinite(ev) ? ev : null;
    }

    /**
     * Parses "1/250", "0.004", "f/8", "24 mm" or "ISO 400" style values.
     */
    public static Double parseNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("f/")) {
            value = value.substring(2).trim();
        } else if (value.startsWith("iso")) {
            value = value.substring(3).trim();
        }
        Matcher matcher = NUMBER_OR_FRACTION.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        double numerator = Double.parseDouble(matcher.group(1));
        double result = numerator;
        if (matcher.group(2) != null) {
            double denominator = Double.parseDouble(matcher.group(2));
            if (denominator == 0) {
                return null;
            }
            result = numerator / denominator;
        }
        return Double.isFinite(result) ? result : null;
    }

    public static Instant parseCaptureTime(String raw, String offset) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        ZoneOffset zone = parseOffset(offset);
        Matcher offsetMatcher = TRAILING_OFFSET.matcher(value);
        if (offsetMatcher.matches() && offsetMatcher.group(1).length() >= 19) {
            ZoneOffset embedded = parseOffset(offsetMatcher.group(2));
            if (embedded != null) {
                zone = embedded;
                value = offsetMatcher.group(1).trim();
            }
        }
        try {
            LocalDateTime local = LocalDateTime.parse(value, EXIF_DATE_TIME);
            return local.toInstant(zone != null ? zone : ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant firstTime(String offset, String... candidates) {
        for (String candidate : candidates) {
            Instant parsed = parseCaptureTime(candidate, offset);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static ZoneOffset parseOffset(String offset) {
        if (offset == null || offset.isBlank()) {
            return null;
        }
        String value = offset.trim();
        if ("Z".equalsIgnoreCase(value)) {
            return ZoneOffset.UTC;
        }
        if (value.length() == 5 && value.indexOf(':') < 0) {
            value = value.substring(0, 3) + ":" + value.substring(3);
        }
        try {
            return ZoneOffset.of(value);
        } catch (RuntimeException e) {
            return null;
        }
    }

    private static Double positive(Double value) {
        return value != null && value > 0 ? value : null;
    }

    /**
     * Trims and strips NUL bytes, which PostgreSQL text columns reject.
     */
    private static String cleanText(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value.replace("\u0000", "").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }
}
