package com.starscape.bracketflow.features.jobs.domain;

import java.util.Locale;

public enum GroupStatus {
    QUEUED,
    SKIPPED,
    PROCESSING,
    SUCCEEDED,
    FAILED;
    
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
    
    public boolean isActive() {
        return this != SKIPPED;
    }
    
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
