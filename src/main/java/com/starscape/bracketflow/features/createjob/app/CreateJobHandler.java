package com.starscape.bracketflow.features.createjob.app;

import com.starscape.bracketflow.common.exception.NotFoundException;
import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.features.createjob.api.dto.CreateJobRequest;
import com.starscape.bracketflow.features.createjob.api.dto.CreateJobResponse;
import com.starscape.bracketflow.features.jobs.app.StorageLayout;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobRepository;
import com.starscape.bracketflow.features.jobs.domain.Workflow;
import com.starscape.bracketflow.features.jobs.domain.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class CreateJobHandler {
    
    private static final Logger log = LoggerFactory.getLogger(CreateJobHandler.class);
    
    private final JobRepository jobRepository;
    private final WorkflowRepository workflowRepository;
    private final StorageLayout storageLayout;
    
    public CreateJobHandler(
            JobRepository jobRepository,
            WorkflowRepository workflowRepository,
            StorageLayout storageLayout) {
        this.jobRepository = jobRepository;
        this.workflowRepository = workflowRepository;
        this.storageLayout = storageLayout;
    }
    
    @Transactional
    public CreateJobResponse handle(CreateJobRequest request, String userId) {
        Workflow workflow = resolveWorkflow(request.workflowId().trim());
        if (!workflow.isActive()) {
            throw new ValidationException("Workflow " + workflow.getSlug() + " is not available");
        }
        
        String jobId = "job_" + UUID.randomUUID().toString().replace("-", "");
        String projectName = request.projectName() != null && !request.projectName().isBlank()
            ? request.projectName().trim()
            : null;
        Job job = new Job(jobId, userId, workflow, projectName);
        jobRepository.save(job);
        
        log.info("Created job {} for user {} on workflow {}", jobId, userId, workflow.getSlug());
        return new CreateJobResponse(
            jobId,
            job.getStatus().wireValue(),
            workflow.getWorkflowId(),
            workflow.getSlug(),
            projectName,
            workflow.getCreditPerUnit(),
            workflow.getMaxAttempts(),
            storageLayout.uploadPrefix(userId, jobId),
            job.getCreatedAt()
        );
    }
    
    private Workflow resolveWorkflow(String reference) {
        return workflowRepository.findById(reference)
                .or(() -> workflowRepository.findBySlug(reference))
                .orElseThrow(() -> new NotFoundException("Workflow not found: " + reference));
    }
}
