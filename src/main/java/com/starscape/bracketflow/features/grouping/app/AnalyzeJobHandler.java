package com.starscape.bracketflow.features.grouping.app;

import com.starscape.bracketflow.common.config.GroupingProperties;
import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.features.grouping.api.dto.AnalyzeJobResponse;
import com.starscape.bracketflow.features.grouping.api.dto.GroupSummary;
import com.starscape.bracketflow.features.grouping.domain.BracketGroupingEngine;
import com.starscape.bracketflow.features.grouping.domain.FrameMetadata;
import com.starscape.bracketflow.features.grouping.domain.GroupSpec;
import com.starscape.bracketflow.features.jobs.app.JobLookup;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobStatus;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.jobs.domain.UploadedFileRepository;
import com.starscape.bracketflow.features.jobs.domain.events.GroupingProgress;
import com.starscape.bracketflow.features.jobs.domain.events.JobGrouped;
import com.starscape.bracketflow.features.metadata.app.MetadataExtractionService;
import com.starscape.bracketflow.features.metadata.domain.CaptureMetadata;
import com.starscape.bracketflow.features.trackprogress.app.JobEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs metadata extraction and bracket grouping for a job.
 * <p>
 * Three steps: enter {@code analyzing} under the row lock, read missing EXIF with no
 * transaction open, then write the new groups and move to {@code input_resolved} under
 * the row lock again. Concurrent analyze requests for the same job queue on {@link JobLocks}.
 */
@Service
public class AnalyzeJobHandler {
    
    private static final Logger log = LoggerFactory.getLogger(AnalyzeJobHandler.class);
    
    private final JobLookup jobLookup;
    private final UploadedFileRepository fileRepository;
    private final MetadataExtractionService metadataExtractionService;
    private final CaptureGroupWriter groupWriter;
    private final JobEventBus eventBus;
    private final JobLocks jobLocks;
    private final TransactionOperations transactionOperations;
    private final BracketGroupingEngine groupingEngine;
    
    public AnalyzeJobHandler(
            JobLookup jobLookup,
            UploadedFileRepository fileRepository,
            MetadataExtractionService metadataExtractionService,
            CaptureGroupWriter groupWriter,
            JobEventBus eventBus,
            JobLocks jobLocks,
            TransactionOperations transactionOperations,
            GroupingProperties groupingProperties) {
        this.jobLookup = jobLookup;
        this.fileRepository = fileRepository;
        this.metadataExtractionService = metadataExtractionService;
        this.groupWriter = groupWriter;
        this.eventBus = eventBus;
        this.jobLocks = jobLocks;
        this.transactionOperations = transactionOperations;
        this.groupingEngine = new BracketGroupingEngine(groupingProperties);
    }
    
    public AnalyzeJobResponse handle(String jobId, String userId) {
        return jobLocks.withLock(jobId, () -> analyze(jobId, userId));
    }
    
    private AnalyzeJobResponse analyze(String jobId, String userId) {
        List<UploadedFile> files = transactionOperations.execute(status -> beginAnalysis(jobId, userId));
        
        try {
            Map<String, CaptureMetadata> extracted = metadataExtractionService.extractMissing(jobId, files);
            return transactionOperations.execute(status -> commitGrouping(jobId, extracted));
        } catch (RuntimeException e) {
            log.error("Analysis of job {} failed", jobId, e);
            abortAnalysis(jobId, e);
            throw e;
        }
    }
    
    private List<UploadedFile> beginAnalysis(String jobId, String userId) {
        Job job = jobLookup.lockOwned(jobId, userId);
        List<UploadedFile> confirmed = confirmedFiles(jobId);
        if (confirmed.isEmpty()) {
            throw new ValidationException("Job " + jobId + " has no uploaded files to analyze");
        }
        job.beginAnalysis();
        eventBus.publishPending(job);
        eventBus.append(job, new GroupingProgress(jobId, 0, Instant.now()));
        log.info("Analyzing job {} with {} files", jobId, confirmed.size());
        return confirmed;
    }
    
    private AnalyzeJobResponse commitGrouping(String jobId, Map<String, CaptureMetadata> extracted) {
        Job job = jobLookup.lock(jobId);
        if (job.getStatus() != JobStatus.ANALYZING) {
            throw new IllegalStateException("Job " + jobId + " left analysis while grouping (now "
                + job.getStatus().wireValue() + ")");
        }
        
        List<UploadedFile> allFiles = fileRepository.findByJobIdOrderByCreatedAtAsc(jobId);
        List<UploadedFile> confirmed = allFiles.stream().filter(UploadedFile::isUploadConfirmed).toList();
        for (UploadedFile file : confirmed) {
            CaptureMetadata metadata = extracted.get(file.getFileId());
            if (metadata != null) {
                file.applyMetadata(metadata);
                file.markMetadataExtracted();
            }
        }
        
        List<FrameMetadata> frames = confirmed.stream().map(FrameMetadata::from).toList();
        List<GroupSpec> specs = groupingEngine.group(frames);
        GroupingResult result = groupWriter.replace(job, allFiles, specs);
        
        job.resolveInput(result.groups().size(), result.inputType(), result.maxConfidence());
        eventBus.append(job, new JobGrouped(jobId, confirmed.size(), result.groups().size(),
            result.eventItems(), Instant.now()));
        eventBus.publishPending(job);
        eventBus.append(job, new GroupingProgress(jobId, 100, Instant.now()));
        
        log.info("Job {} grouped: {} files into {} groups ({} hdr)", jobId, confirmed.size(),
            result.groups().size(), result.hdrGroupCount());
        return toResponse(job, confirmed.size(), result);
    }
    
    private void abortAnalysis(String jobId, RuntimeException cause) {
        try {
            transactionOperations.executeWithoutResult(status -> {
                Job job = jobLookup.lock(jobId);
                job.abortAnalysis(cause.getMessage());
                eventBus.publishPending(job);
            });
        } catch (RuntimeException e) {
            log.error("Could not return job {} to grouping after failed analysis", jobId, e);
            cause.addSuppressed(e);
        }
    }
    
    private List<UploadedFile> confirmedFiles(String jobId) {
        return fileRepository.findByJobIdOrderByCreatedAtAsc(jobId).stream()
                .filter(UploadedFile::isUploadConfirmed)
                .toList();
    }
    
    private AnalyzeJobResponse toResponse(Job job, int totalFiles, GroupingResult result) {
        List<GroupSummary> groups = result.groups().stream()
                .map(group -> new GroupSummary(
                    group.getGroupId(),
                    group.getGroupIndex(),
                    group.getGroupType().wireValue(),
                    group.getHdrConfidence(),
                    group.getGroupSize(),
                    group.getOutputFilename(),
                    group.getRepresentativeIndex(),
                    result.frameNames(group.getGroupId())
                ))
                .toList();
        return new AnalyzeJobResponse(
            job.getJobId(),
            job.getStatus().wireValue(),
            totalFiles,
            result.groups().size(),
            result.hdrGroupCount(),
            job.getInputType(),
            job.getHdrConfidence(),
            groups
        );
    }
}
