package com.starscape.bracketflow.features.registerfiles.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record RegisterFilesRequest(
    @NotEmpty(message = "Files list cannot be empty")
    @Size(max = 1000, message = "Maximum 1000 files per request")
    @Valid
    List<FileRegistration> files
) {}
