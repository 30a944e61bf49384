package com.starscape.bracketflow.features.jobs.domain;

import java.util.List;

public interface CaptureGroupRepository {
    CaptureGroup save(CaptureGroup group);
    <S extends CaptureGroup> List<S> saveAll(Iterable<S> groups);
    List<CaptureGroup> findByJobIdOrderByGroupIndexAsc(String jobId);
    void deleteByJobId(String jobId);
}
