package com.starscape.bracketflow.features.lifecycle.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Progress or results reported by the compute provider for one dispatch.
 * At least one of {@code manifestKey} and {@code executionHandle} identifies the dispatch.
 */
public record ComputeCallbackRequest(
    @NotBlank(message = "jobId is required")
    String jobId,
    
    String manifestKey,
    
    String executionHandle,
    
    String stage,
    
    String error,
    
    @Valid
    List<GroupResult> groups
) {
    
    /**
     * One group's outcome. In grouping mode {@code files} lists the storage keys the
     * provider put together and {@code confidence} its bracket score.
     */
    public record GroupResult(
        String groupId,
        Integer groupIndex,
        String resultKey,
        String error,
        List<String> files,
        Double confidence
    ) {}
}
