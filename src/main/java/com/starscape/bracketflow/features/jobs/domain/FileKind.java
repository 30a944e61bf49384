package com.starscape.bracketflow.features.jobs.domain;

import java.util.Locale;
import java.util.Set;

/**
 * Kind of an uploaded file, detected from its extension.
 */
public enum FileKind {
    RAW,
    JPG,
    PNG,
    OTHER;
    
    private static final Set<String> RAW_EXTENSIONS = Set.of("cr2", "cr3", "nef", "arw", "dng", "raf", "rw2", "orf");
    
    public static FileKind fromFilename(String filename) {
        if (filename == null) {
            return OTHER;
        }
        int lastDot = filename.lastIndexOf('.');
        if (lastDot < 0 || lastDot == filename.length() - 1) {
            return OTHER;
        }
        String extension = filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        if (RAW_EXTENSIONS.contains(extension)) {
            return RAW;
        }
        return switch (extension) {
            case "jpg", "jpeg" -> JPG;
            case "png" -> PNG;
            default -> OTHER;
        };
    }
    
    /**
     * Raw and rendered stills take part in bracket detection; anything else passes through.
     */
    public boolean isBracketCandidate() {
        return this != OTHER;
    }
    
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
