package com.starscape.bracketflow.features.jobs.app;

import com.starscape.bracketflow.common.exception.NotFoundException;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobRepository;
import org.springframework.stereotype.Component;

/**
 * Resolves jobs on behalf of a caller. A job owned by someone else is reported as missing.
 */
@Component
public class JobLookup {
    
    private final JobRepository jobRepository;
    
    public JobLookup(JobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }
    
    public Job requireOwned(String jobId, String userId) {
        return jobRepository.findById(jobId)
                .filter(job -> job.isOwnedBy(userId))
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
    }
    
    /**
     * Same as {@link #requireOwned} but takes the job row lock. Requires a transaction.
     */
    public Job lockOwned(String jobId, String userId) {
        return jobRepository.findByIdForUpdate(jobId)
                .filter(job -> job.isOwnedBy(userId))
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
    }
    
    public Job lock(String jobId) {
        return jobRepository.findByIdForUpdate(jobId)
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
    }
}
