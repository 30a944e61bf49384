package com.starscape.bracketflow.features.registerfiles.api.dto;

public record RegisteredFile(
    String fileId,
    String storageKey,
    String filename,
    String kind,
    boolean uploadConfirmed
) {}
