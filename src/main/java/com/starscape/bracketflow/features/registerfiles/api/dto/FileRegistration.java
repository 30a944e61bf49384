package com.starscape.bracketflow.features.registerfiles.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;

public record FileRegistration(
    @NotBlank(message = "Storage key is required")
    @Size(max = 1024, message = "Storage key too long")
    String storageKey,
    
    @NotBlank(message = "Filename is required")
    @Size(max = 255, message = "Filename too long")
    String filename,
    
    @PositiveOrZero(message = "File size must not be negative")
    Long bytes,
    
    Boolean uploaded,
    
    @Valid
    ClientExifHints metadata
) {}
