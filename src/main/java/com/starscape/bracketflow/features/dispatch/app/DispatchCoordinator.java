package com.starscape.bracketflow.features.dispatch.app;

import com.starscape.bracketflow.common.config.DispatchProperties;
import com.starscape.bracketflow.common.exception.ExternalDispatchException;
import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.features.dispatch.domain.ComputeProviderClient;
import com.starscape.bracketflow.features.dispatch.domain.ComputeSubmission;
import com.starscape.bracketflow.features.dispatch.domain.DispatchResult;
import com.starscape.bracketflow.features.dispatch.domain.Manifest;
import com.starscape.bracketflow.features.dispatch.domain.ManifestBuilder;
import com.starscape.bracketflow.features.dispatch.domain.ManifestStore;
import com.starscape.bracketflow.features.jobs.app.JobLookup;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroup;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroupRepository;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobRepository;
import com.starscape.bracketflow.features.jobs.domain.ProcessingMode;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.jobs.domain.UploadedFileRepository;
import com.starscape.bracketflow.features.jobs.domain.events.DispatchStarted;
import com.starscape.bracketflow.features.trackprogress.app.JobEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sends a job's work to the compute provider at most once per manifest.
 * <p>
 * The manifest is recorded under the job lock, the provider is called with no transaction
 * open and only while holding an {@link AdmissionGate} slot, and the returned handle is
 * recorded under the lock again. On provider failure the manifest is cleared and an
 * {@link ExternalDispatchException} is thrown; releasing credits and reverting the job
 * status is left to the caller, which owns the reservation.
 */
@Service
public class DispatchCoordinator {
    
    private static final Logger log = LoggerFactory.getLogger(DispatchCoordinator.class);
    
    private final JobLookup jobLookup;
    private final JobRepository jobRepository;
    private final CaptureGroupRepository groupRepository;
    private final UploadedFileRepository fileRepository;
    private final ManifestStore manifestStore;
    private final ComputeProviderClient providerClient;
    private final AdmissionGate admissionGate;
    private final DispatchMetrics metrics;
    private final OperationalAlerts alerts;
    private final JobEventBus eventBus;
    private final TransactionOperations transactionOperations;
    private final DispatchProperties properties;
    
    public DispatchCoordinator(
            JobLookup jobLookup,
            JobRepository jobRepository,
            CaptureGroupRepository groupRepository,
            UploadedFileRepository fileRepository,
            ManifestStore manifestStore,
            ComputeProviderClient providerClient,
            AdmissionGate admissionGate,
            DispatchMetrics metrics,
            OperationalAlerts alerts,
            JobEventBus eventBus,
            TransactionOperations transactionOperations,
            DispatchProperties properties) {
        this.jobLookup = jobLookup;
        this.jobRepository = jobRepository;
        this.groupRepository = groupRepository;
        this.fileRepository = fileRepository;
        this.manifestStore = manifestStore;
        this.providerClient = providerClient;
        this.admissionGate = admissionGate;
        this.metrics = metrics;
        this.alerts = alerts;
        this.eventBus = eventBus;
        this.transactionOperations = transactionOperations;
        this.properties = properties;
    }
    
    public DispatchResult dispatch(String jobId, ProcessingMode mode) {
        Prepared prepared = transactionOperations.execute(status -> prepare(jobId, mode));
        if (prepared.existing() != null) {
            return prepared.existing();
        }
        return submit(prepared);
    }
    
    private Prepared prepare(String jobId, ProcessingMode mode) {
        Job job = jobLookup.lock(jobId);
        Manifest manifest = ManifestBuilder.build(manifestFiles(job, mode), mode);
        if (manifest.size() == 0) {
            throw new ValidationException("Job " + jobId + " has no files to dispatch");
        }
        
        if (job.isDispatchLive(manifest.hash())) {
            int pending = metrics.pending();
            log.info("Manifest {} of job {} is already running as {}, not dispatching again",
                manifest.hash(), jobId, job.getExecutionHandle());
            return new Prepared(job, manifest, job.getManifestKey(), new DispatchResult(
                job.getExecutionHandle(), job.getManifestKey(), manifest.hash(), true,
                manifest.size(), pending, metrics.etaSeconds(pending)));
        }
        
        if (job.isSubmissionPending(manifest.hash(), Instant.now().minus(properties.getSubmissionTimeout()))) {
            throw new IllegalStateException(
                "Manifest " + manifest.hash() + " of job " + jobId + " is already being submitted");
        }
        
        String manifestKey = manifestStore.store(jobId, manifest);
        job.recordManifest(manifestKey, manifest.hash(), mode);
        jobRepository.save(job);
        return new Prepared(job, manifest, manifestKey, null);
    }
    
    private DispatchResult submit(Prepared prepared) {
        Job job = prepared.job();
        String jobId = job.getJobId();
        Manifest manifest = prepared.manifest();
        ComputeSubmission submission = new ComputeSubmission(
            jobId,
            job.getWorkflowId(),
            prepared.manifestKey(),
            manifest.hash(),
            manifest.mode().wireValue(),
            manifest.size(),
            properties.getCallbackUrl()
        );
        
        metrics.beginWaiting();
        String handle;
        try (AdmissionGate.Permit permit = admissionGate.acquire()) {
            handle = providerClient.submit(submission);
        } catch (RuntimeException e) {
            metrics.abortWaiting();
            alerts.dispatchFailed(jobId, e);
            ExternalDispatchException failure = new ExternalDispatchException(
                "Compute provider did not accept job " + jobId + ": " + e.getMessage(), e);
            clearManifest(jobId, manifest.hash(), failure);
            throw failure;
        }
        
        metrics.recordStart(jobId);
        int pending = metrics.pending();
        long eta = metrics.etaSeconds(pending);
        if (pending > properties.getQueueAlertThreshold()) {
            alerts.queueBacklog(pending, properties.getQueueAlertThreshold());
        }
        if (eta > properties.getEtaAlertSeconds()) {
            alerts.etaExceeded(jobId, eta, properties.getEtaAlertSeconds());
        }
        
        return transactionOperations.execute(status -> {
            Job locked = jobLookup.lock(jobId);
            if (!locked.recordExecution(manifest.hash(), handle)) {
                log.warn("Manifest {} of job {} was superseded before execution {} was recorded",
                    manifest.hash(), jobId, handle);
            }
            jobRepository.save(locked);
            if (!locked.getStatus().isTerminal()) {
                eventBus.append(locked, new DispatchStarted(jobId, manifest.mode().wireValue(), manifest.hash(),
                    manifest.size(), pending, eta, Instant.now()));
            }
            log.info("Dispatched job {} as {} ({} files, {} pending, eta {}s)", jobId, handle, manifest.size(), pending, eta);
            return new DispatchResult(handle, prepared.manifestKey(), manifest.hash(), false,
                manifest.size(), pending, eta);
        });
    }
    
    private void clearManifest(String jobId, String hash, RuntimeException failure) {
        try {
            transactionOperations.executeWithoutResult(status -> {
                Job job = jobLookup.lock(jobId);
                job.clearManifest(hash);
                jobRepository.save(job);
            });
        } catch (RuntimeException e) {
            log.error("Could not clear failed manifest {} of job {}", hash, jobId, e);
            failure.addSuppressed(e);
        }
    }
    
    /**
     * Storage keys to process: members of queued or processing groups, or every uploaded
     * file when the provider does the grouping.
     */
    List<String> manifestFiles(Job job, ProcessingMode mode) {
        List<UploadedFile> files = fileRepository.findByJobIdOrderByCreatedAtAsc(job.getJobId());
        if (mode == ProcessingMode.GROUP) {
            return files.stream()
                    .filter(UploadedFile::isUploadConfirmed)
                    .map(UploadedFile::getStorageKey)
                    .toList();
        }
        Set<String> awaiting = groupRepository.findByJobIdOrderByGroupIndexAsc(job.getJobId()).stream()
                .filter(CaptureGroup::isAwaitingResult)
                .map(CaptureGroup::getGroupId)
                .collect(Collectors.toSet());
        return files.stream()
                .filter(file -> file.getGroupId() != null && awaiting.contains(file.getGroupId()))
                .map(UploadedFile::getStorageKey)
                .toList();
    }
    
    private record Prepared(Job job, Manifest manifest, String manifestKey, DispatchResult existing) {
    }
}
