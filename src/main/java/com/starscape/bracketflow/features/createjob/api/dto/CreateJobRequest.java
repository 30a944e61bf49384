package com.starscape.bracketflow.features.createjob.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateJobRequest(
    @NotBlank(message = "Workflow is required")
    @Size(max = 128, message = "Workflow reference too long")
    String workflowId,
    
    @Size(max = 255, message = "Project name too long")
    String projectName
) {}
