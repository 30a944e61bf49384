package com.starscape.bracketflow.features.dispatch.domain;

/**
 * @param reused true when the manifest was already live and the provider was not called
 */
public record DispatchResult(
    String executionHandle,
    String manifestKey,
    String manifestHash,
    boolean reused,
    int fileCount,
    int queuePending,
    long etaSeconds
) {}
