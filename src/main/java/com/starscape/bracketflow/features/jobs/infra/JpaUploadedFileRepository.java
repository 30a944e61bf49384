package com.starscape.bracketflow.features.jobs.infra;

import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.jobs.domain.UploadedFileRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaUploadedFileRepository extends JpaRepository<UploadedFile, String>, UploadedFileRepository {
}
