package com.starscape.bracketflow.features.metadata.domain;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Trailing frame counter of a camera filename, e.g. {@code IMG_0042.CR2} is
 * prefix {@code IMG_}, number 42, pad width 4.
 */
public record SequenceToken(String prefix, long number, int padWidth) {
    
    private static final Pattern TRAILING_DIGITS = Pattern.compile("^(.*?)(\\d+)(\\.[^.]+)?$");
    private static final int MAX_DIGITS = 18;
    
    public static Optional<SequenceToken> parse(String filename) {
        if (filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        String base = basename(filename);
        Matcher matcher = TRAILING_DIGITS.matcher(base);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String digits = matcher.group(2);
        if (digits.length() > MAX_DIGITS) {
            return Optional.empty();
        }
        return Optional.of(new SequenceToken(matcher.group(1), Long.parseLong(digits), digits.length()));
    }
    
    /**
     * True when {@code next} is the frame directly after this one in the same series.
     */
    public boolean isFollowedBy(SequenceToken next) {
        return next != null && prefix.equals(next.prefix) && next.number == number + 1;
    }
    
    static String basename(String filename) {
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        return slash >= 0 ? filename.substring(slash + 1) : filename;
    }
}
