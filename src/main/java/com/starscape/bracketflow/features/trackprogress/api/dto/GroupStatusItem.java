package com.starscape.bracketflow.features.trackprogress.api.dto;

import java.util.List;

public record GroupStatusItem(
    String groupId,
    int index,
    String type,
    String status,
    Double confidence,
    String outputFilename,
    int groupSize,
    int representativeIndex,
    List<String> frames,
    int attempts,
    String lastError,
    String resultKey
) {}
