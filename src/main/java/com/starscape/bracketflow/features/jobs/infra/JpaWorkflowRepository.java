package com.starscape.bracketflow.features.jobs.infra;

import com.starscape.bracketflow.features.jobs.domain.Workflow;
import com.starscape.bracketflow.features.jobs.domain.WorkflowRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaWorkflowRepository extends JpaRepository<Workflow, String>, WorkflowRepository {
}
