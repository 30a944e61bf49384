package com.starscape.bracketflow.features.registerfiles.app;

import com.starscape.bracketflow.features.jobs.app.JobLookup;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobStatus;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.jobs.domain.UploadedFileRepository;
import com.starscape.bracketflow.features.jobs.domain.events.FilesRegistered;
import com.starscape.bracketflow.features.trackprogress.app.JobEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Marks a registered file as present in storage. The confirmation that completes the
 * declared set moves the job on to {@code grouping}.
 */
@Service
public class UploadConfirmationService {
    
    private static final Logger log = LoggerFactory.getLogger(UploadConfirmationService.class);
    
    private final JobLookup jobLookup;
    private final UploadedFileRepository fileRepository;
    private final JobEventBus eventBus;
    
    public UploadConfirmationService(JobLookup jobLookup, UploadedFileRepository fileRepository, JobEventBus eventBus) {
        this.jobLookup = jobLookup;
        this.fileRepository = fileRepository;
        this.eventBus = eventBus;
    }
    
    /**
     * This method is idempotent - repeated notifications for the same object change nothing.
     *
     * @return true when this call confirmed the file
     */
    @Transactional
    public boolean confirm(String storageKey, long size) {
        Optional<UploadedFile> found = fileRepository.findByStorageKey(storageKey);
        if (found.isEmpty()) {
            log.debug("No registered file for uploaded object {}", storageKey);
            return false;
        }
        UploadedFile file = found.get();
        Job job = jobLookup.lock(file.getJobId());
        if (file.isUploadConfirmed()) {
            log.debug("Upload of {} already confirmed", storageKey);
            return false;
        }
        if (job.getStatus().isTerminal()) {
            log.info("Ignoring upload of {} for job {} in status {}", storageKey, job.getJobId(),
                job.getStatus().wireValue());
            return false;
        }
        
        file.confirmUpload();
        fileRepository.save(file);
        long declared = fileRepository.countByJobId(job.getJobId());
        long confirmed = fileRepository.countByJobIdAndUploadConfirmedTrue(job.getJobId());
        if (job.getStatus() == JobStatus.DRAFT || job.getStatus() == JobStatus.UPLOADING) {
            job.recordUploads(declared, confirmed);
            eventBus.publishPending(job);
        }
        eventBus.append(job, new FilesRegistered(job.getJobId(), declared, confirmed, Instant.now()));
        
        log.info("Confirmed upload of {} ({} bytes) for job {}: {} of {} files", storageKey, size,
            job.getJobId(), confirmed, declared);
        return true;
    }
}
