package com.starscape.bracketflow.features.grouping.api.dto;

import java.util.List;

public record GroupSummary(
    String groupId,
    int index,
    String type,
    Double confidence,
    int size,
    String outputFilename,
    int representativeIndex,
    List<String> frames
) {}
