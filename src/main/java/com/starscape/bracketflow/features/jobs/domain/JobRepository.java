package com.starscape.bracketflow.features.jobs.domain;

import java.util.Optional;

public interface JobRepository {
    Job save(Job job);
    Optional<Job> findById(String jobId);

    /**
     * Loads the job holding a row lock until the surrounding transaction ends.
     * Every state change and event append for a job goes through this lock.
     */
    Optional<Job> findByIdForUpdate(String jobId);
}
