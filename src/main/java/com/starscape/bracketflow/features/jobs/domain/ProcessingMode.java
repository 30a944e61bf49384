package com.starscape.bracketflow.features.jobs.domain;

import java.util.Locale;

/**
 * What the compute provider is asked to do with a manifest.
 */
public enum ProcessingMode {
    /** Merge and process the job's resolved capture groups. */
    FULL,
    /** Only group the files; results replace the job's capture groups. */
    GROUP;
    
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    public static ProcessingMode fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        return ProcessingMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
