package com.starscape.bracketflow.features.registerfiles.app;

import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.features.jobs.app.JobLookup;
import com.starscape.bracketflow.features.jobs.app.StorageLayout;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.jobs.domain.UploadedFileRepository;
import com.starscape.bracketflow.features.jobs.domain.events.FilesRegistered;
import com.starscape.bracketflow.features.metadata.domain.MetadataNormalizer;
import com.starscape.bracketflow.features.registerfiles.api.dto.FileRegistration;
import com.starscape.bracketflow.features.registerfiles.api.dto.RegisterFilesRequest;
import com.starscape.bracketflow.features.registerfiles.api.dto.RegisterFilesResponse;
import com.starscape.bracketflow.features.registerfiles.api.dto.RegisteredFile;
import com.starscape.bracketflow.features.trackprogress.app.JobEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
public class RegisterFilesHandler {
    
    private static final Logger log = LoggerFactory.getLogger(RegisterFilesHandler.class);
    
    private final JobLookup jobLookup;
    private final UploadedFileRepository fileRepository;
    private final StorageLayout storageLayout;
    private final JobEventBus eventBus;
    
    public RegisterFilesHandler(
            JobLookup jobLookup,
            UploadedFileRepository fileRepository,
            StorageLayout storageLayout,
            JobEventBus eventBus) {
        this.jobLookup = jobLookup;
        this.fileRepository = fileRepository;
        this.storageLayout = storageLayout;
        this.eventBus = eventBus;
    }
    
    @Transactional
    public RegisterFilesResponse handle(String jobId, String userId, RegisterFilesRequest request) {
        Job job = jobLookup.lockOwned(jobId, userId);
        
        Set<String> seen = new HashSet<>();
        List<UploadedFile> touched = new ArrayList<>();
        for (FileRegistration registration : request.files()) {
            String key = registration.storageKey().trim();
            if (!storageLayout.isUploadKey(key, userId, jobId)) {
                throw new ValidationException("Storage key " + key + " is outside the upload prefix "
                    + storageLayout.uploadPrefix(userId, jobId));
            }
            if (!seen.add(key)) {
                throw new ValidationException("Storage key " + key + " is listed more than once");
            }
            
            UploadedFile file = fileRepository.findByJobIdAndStorageKey(jobId, key)
                    .orElseGet(() -> new UploadedFile(
                        "fil_" + UUID.randomUUID().toString().replace("-", ""),
                        jobId,
                        key,
                        sanitizeFilename(registration.filename()),
                        registration.bytes()
                    ));
            if (registration.metadata() != null) {
                file.applyMetadata(MetadataNormalizer.normalize(registration.metadata().toRawTags()));
            }
            if (Boolean.TRUE.equals(registration.uploaded())) {
                file.confirmUpload();
            }
            touched.add(file);
        }
        fileRepository.saveAll(touched);
        
        long declared = fileRepository.countByJobId(jobId);
        long confirmed = fileRepository.countByJobIdAndUploadConfirmedTrue(jobId);
        job.recordUploads(declared, confirmed);
        eventBus.publishPending(job);
        eventBus.append(job, new FilesRegistered(jobId, declared, confirmed, Instant.now()));
        
        log.info("Registered {} files for job {} ({} of {} confirmed)", touched.size(), jobId, confirmed, declared);
        List<RegisteredFile> items = touched.stream()
                .map(file -> new RegisteredFile(
                    file.getFileId(),
                    file.getStorageKey(),
                    file.getFilename(),
                    file.getKind().wireValue(),
                    file.isUploadConfirmed()
                ))
                .toList();
        return new RegisterFilesResponse(jobId, job.getStatus().wireValue(), declared, confirmed, items);
    }
    
    /**
     * Keeps only the last path segment; control characters are dropped.
     */
    static String sanitizeFilename(String raw) {
        String name = raw.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = name.replaceAll("\\p{Cntrl}", "").trim();
        return name.isEmpty() ? "image" : name;
    }
}
