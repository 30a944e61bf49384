package com.starscape.bracketflow.features.registerfiles.api.dto;

import java.util.List;

public record RegisterFilesResponse(
    String jobId,
    String status,
    long declared,
    long confirmed,
    List<RegisteredFile> files
) {}
