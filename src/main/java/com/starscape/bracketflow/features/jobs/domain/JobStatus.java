package com.starscape.bracketflow.features.jobs.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum JobStatus {
    DRAFT,
    UPLOADING,
    GROUPING,
    ANALYZING,
    INPUT_RESOLVED,
    RESERVED,
    HDR_PROCESSING,
    WORKFLOW_RUNNING,
    AI_PROCESSING,
    POSTPROCESS,
    PACKAGING,
    COMPLETED,
    PARTIAL,
    FAILED,
    CANCELED;
    
    private static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, PARTIAL, FAILED, CANCELED);
    private static final Set<JobStatus> PROCESSING = EnumSet.range(RESERVED, PACKAGING);
    private static final Set<JobStatus> STAGES = EnumSet.range(HDR_PROCESSING, PACKAGING);
    private static final Set<JobStatus> ANALYZABLE = EnumSet.of(UPLOADING, GROUPING, ANALYZING, INPUT_RESOLVED);
    
    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
    
    /**
     * Credits are held and work is with, or on its way to, the compute provider.
     */
    public boolean isProcessing() {
        return PROCESSING.contains(this);
    }
    
    /**
     * Statuses in which a recorded execution handle is still considered live.
     */
    public boolean isDispatchInProgress() {
        return this == GROUPING || isProcessing();
    }
    
    public boolean isStage() {
        return STAGES.contains(this);
    }
    
    public boolean acceptsAnalysis() {
        return ANALYZABLE.contains(this);
    }
    
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    public static JobStatus fromWireValue(String value) {
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
