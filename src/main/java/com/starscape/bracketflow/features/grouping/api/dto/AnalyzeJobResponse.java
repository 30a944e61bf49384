package com.starscape.bracketflow.features.grouping.api.dto;

import java.util.List;

public record AnalyzeJobResponse(
    String jobId,
    String status,
    int totalFiles,
    int totalGroups,
    int hdrGroups,
    String inputType,
    Double hdrConfidence,
    List<GroupSummary> groups
) {}
