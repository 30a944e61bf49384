package com.starscape.bracketflow.features.trackprogress.domain;

import java.util.List;

public interface JobEventRepository {
    JobEvent save(JobEvent event);
    List<JobEvent> findByJobIdAndSequenceGreaterThanOrderBySequenceAsc(String jobId, long sequence);
}
