package com.starscape.bracketflow.features.jobs.infra;

import com.starscape.bracketflow.features.jobs.domain.CaptureGroup;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroupRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCaptureGroupRepository extends JpaRepository<CaptureGroup, String>, CaptureGroupRepository {
    
    /**
     * Bulk delete so the rows are gone before the replacement groups (same indexes) are inserted.
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM CaptureGroup g WHERE g.jobId = :jobId")
    void deleteByJobId(@Param("jobId") String jobId);
}
