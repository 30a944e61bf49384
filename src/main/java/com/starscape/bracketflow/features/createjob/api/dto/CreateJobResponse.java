package com.starscape.bracketflow.features.createjob.api.dto;

import java.time.Instant;

public record CreateJobResponse(
    String jobId,
    String status,
    String workflowId,
    String workflowSlug,
    String projectName,
    int creditPerUnit,
    int maxAttempts,
    String uploadPrefix,
    Instant createdAt
) {}
