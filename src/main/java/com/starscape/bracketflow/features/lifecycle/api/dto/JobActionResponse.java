package com.starscape.bracketflow.features.lifecycle.api.dto;

public record JobActionResponse(
    String jobId,
    String status,
    int activeGroups,
    int skippedGroups,
    int reservedUnits,
    String executionHandle,
    String manifestHash,
    boolean dispatchReused,
    Integer queuePending,
    Long etaSeconds,
    boolean changed
) {}
