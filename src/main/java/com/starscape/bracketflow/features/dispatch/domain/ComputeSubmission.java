package com.starscape.bracketflow.features.dispatch.domain;

public record ComputeSubmission(
    String jobId,
    String workflowId,
    String manifestKey,
    String manifestHash,
    String mode,
    int fileCount,
    String callbackUrl
) {}
