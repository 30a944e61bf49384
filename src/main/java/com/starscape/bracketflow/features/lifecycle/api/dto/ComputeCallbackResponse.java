package com.starscape.bracketflow.features.lifecycle.api.dto;

public record ComputeCallbackResponse(
    boolean accepted,
    boolean stale,
    String status,
    int updatedGroups,
    boolean retryScheduled
) {
    
    public static ComputeCallbackResponse stale(String status) {
        return new ComputeCallbackResponse(false, true, status, 0, false);
    }
    
    public static ComputeCallbackResponse ignored(String status) {
        return new ComputeCallbackResponse(false, false, status, 0, false);
    }
}
