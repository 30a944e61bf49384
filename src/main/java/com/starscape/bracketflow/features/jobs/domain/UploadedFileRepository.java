package com.starscape.bracketflow.features.jobs.domain;

import java.util.List;
import java.util.Optional;

public interface UploadedFileRepository {
    UploadedFile save(UploadedFile file);
    <S extends UploadedFile> List<S> saveAll(Iterable<S> files);
    Optional<UploadedFile> findById(String fileId);
    List<UploadedFile> findByJobIdOrderByCreatedAtAsc(String jobId);
    Optional<UploadedFile> findByStorageKey(String storageKey);
    Optional<UploadedFile> findByJobIdAndStorageKey(String jobId, String storageKey);
    long countByJobId(String jobId);
    long countByJobIdAndUploadConfirmedTrue(String jobId);
}
