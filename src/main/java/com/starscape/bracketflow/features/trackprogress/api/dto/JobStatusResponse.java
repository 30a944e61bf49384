package com.starscape.bracketflow.features.trackprogress.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a job with its capture groups.
 */
public record JobStatusResponse(
    String jobId,
    String status,
    String workflowId,
    String projectName,
    String inputType,
    Double hdrConfidence,
    String processingMode,
    int estimatedUnits,
    int reservedUnits,
    int settledUnits,
    GroupCounts counts,
    int progress,
    long lastEventSequence,
    String errorMessage,
    List<GroupStatusItem> groups,
    Instant createdAt,
    Instant updatedAt,
    Instant finishedAt
) {}
