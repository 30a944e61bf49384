package com.starscape.bracketflow.features.jobs.domain;

import java.util.Optional;

public interface WorkflowRepository {
    Workflow save(Workflow workflow);
    Optional<Workflow> findById(String workflowId);
    Optional<Workflow> findBySlug(String slug);
}
