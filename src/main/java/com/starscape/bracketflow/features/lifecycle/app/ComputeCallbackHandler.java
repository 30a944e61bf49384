package com.starscape.bracketflow.features.lifecycle.app;

import com.starscape.bracketflow.common.config.DispatchProperties;
import com.starscape.bracketflow.common.config.GroupingProperties;
import com.starscape.bracketflow.common.exception.CallbackAuthenticationException;
import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.features.dispatch.app.DispatchMetrics;
import com.starscape.bracketflow.features.grouping.app.CaptureGroupWriter;
import com.starscape.bracketflow.features.grouping.app.GroupingResult;
import com.starscape.bracketflow.features.grouping.domain.BracketGroupingEngine;
import com.starscape.bracketflow.features.grouping.domain.FrameMetadata;
import com.starscape.bracketflow.features.grouping.domain.GroupSpec;
import com.starscape.bracketflow.features.jobs.app.JobLookup;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroup;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroupRepository;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobRepository;
import com.starscape.bracketflow.features.jobs.domain.JobStatus;
import com.starscape.bracketflow.features.jobs.domain.ProcessingMode;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.jobs.domain.UploadedFileRepository;
import com.starscape.bracketflow.features.jobs.domain.events.GroupStatusChanged;
import com.starscape.bracketflow.features.jobs.domain.events.JobGrouped;
import com.starscape.bracketflow.features.lifecycle.api.dto.ComputeCallbackRequest;
import com.starscape.bracketflow.features.lifecycle.api.dto.ComputeCallbackRequest.GroupResult;
import com.starscape.bracketflow.features.lifecycle.api.dto.ComputeCallbackResponse;
import com.starscape.bracketflow.features.trackprogress.app.JobEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies results reported by the compute provider.
 * <p>
 * A callback is only trusted when it names the dispatch currently recorded on the job;
 * anything older is answered as stale and changes nothing. When the last active group
 * reaches a terminal status the run is over: retryable failures are sent again once this
 * transaction has committed, otherwise the job is settled.
 */
@Service
public class ComputeCallbackHandler {

    private static final Logger log = LoggerFactory.getLogger(ComputeCallbackHandler.class);

    private final JobLookup jobLookup;
    private final JobRepository jobRepository;
    private final CaptureGroupRepository groupRepository;
    private final UploadedFileRepository fileRepository;
    private final CaptureGroupWriter groupWriter;
    private final JobLifecycleService lifecycleService;
    private final DispatchMetrics dispatchMetrics;
    private final JobEventBus eventBus;
    private final TransactionOperations transactionOperations;
    private final DispatchProperties dispatchProperties;
    private final BracketGroupingEngine groupingEngine;

    public ComputeCallbackHandler(
            JobLookup jobLookup,
            JobRepository jobRepository,
            CaptureGroupRepository groupRepository,
            UploadedFileRepository fileRepository,
            CaptureGroupWriter groupWriter,
            JobLifecycleService lifecycleService,
            DispatchMetrics dispatchMetrics,
            JobEventBus eventBus,
            TransactionOperations transactionOperations,
            DispatchProperties dispatchProperties,
            GroupingProperties groupingProperties) {
        this.jobLookup = jobLookup;
        this.jobRepository = jobRepository;
        this.groupRepository = groupRepository;
        this.fileRepository = fileRepository;
        this.groupWriter = groupWriter;
        this.lifecycleService = lifecycleService;
        this.dispatchMetrics = dispatchMetrics;
        this.eventBus = eventBus;
        this.transactionOperations = transactionOperations;
        this.dispatchProperties = dispatchProperties;
        this.groupingEngine = new BracketGroupingEngine(groupingProperties);
    }

    public ComputeCallbackResponse handle(String callbackSecret, ComputeCallbackRequest request) {
        verifySecret(callbackSecret);
        if (request.manifestKey() == null && request.executionHandle() == null) {
            throw new ValidationException("Callback must carry a manifestKey or an executionHandle");
        }

        Outcome outcome = transactionOperations.execute(status -> apply(request));
        if (outcome.retry()) {
            try {
                lifecycleService.retryAutomatically(request.jobId());
            } catch (RuntimeException e) {
                log.error("Automatic retry of job {} failed", request.jobId(), e);
            }
        }
        return outcome.response();
    }

    private void verifySecret(String provided) {
        String expected = dispatchProperties.getCallbackSecret();
        if (expected == null || expected.isBlank()) {
            log.error("Rejecting compute callback: no callback secret is configured");
            throw new CallbackAuthenticationException();
        }
        if (provided == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            throw new CallbackAuthenticationException();
        }
    }

    private Outcome apply(ComputeCallbackRequest request) {
        Job job = jobLookup.lock(request.jobId());
        String jobId = job.getJobId();
        if (job.getStatus().isTerminal()) {
            log.info("Ignoring callback for job {} in terminal status {}", jobId, job.getStatus().wireValue());
            return Outcome.done(ComputeCallbackResponse.ignored(job.getStatus().wireValue()));
        }
        if (!job.matchesDispatch(request.manifestKey(), request.executionHandle())) {
            log.warn("Discarding stale callback for job {} (manifest {}, execution {}; current {} / {})",
                jobId, request.manifestKey(), request.executionHandle(), job.getManifestKey(), job.getExecutionHandle());
            return Outcome.done(ComputeCallbackResponse.stale(job.getStatus().wireValue()));
        }

        if (job.getProcessingMode() == ProcessingMode.GROUP && job.getStatus() == JobStatus.GROUPING) {
            return Outcome.done(applyRemoteGrouping(job, request));
        }
        return applyResults(job, request);
    }

    // ---- processing results

    private Outcome applyResults(Job job, ComputeCallbackRequest request) {
        String jobId = job.getJobId();
        List<CaptureGroup> groups = groupRepository.findByJobIdOrderByGroupIndexAsc(jobId);
        List<GroupResult> results = request.groups() != null ? request.groups() : List.of();
        List<CaptureGroup> changed = new ArrayList<>();

        if (request.error() != null && results.isEmpty()) {
            for (CaptureGroup group : groups) {
                if (group.isAwaitingResult()) {
                    group.markFailed(request.error());
                    changed.add(group);
                }
            }
        }

        Map<String, CaptureGroup> byId = new HashMap<>();
        Map<Integer, CaptureGroup> byIndex = new HashMap<>();
        for (CaptureGroup group : groups) {
            byId.put(group.getGroupId(), group);
            byIndex.put(group.getGroupIndex(), group);
        }
        for (GroupResult result : results) {
            CaptureGroup group = result.groupId() != null ? byId.get(result.groupId())
                : result.groupIndex() != null ? byIndex.get(result.groupIndex()) : null;
            if (group == null) {
                log.warn("Callback for job {} names unknown group {} / {}", jobId, result.groupId(), result.groupIndex());
                continue;
            }
            if (!group.isAwaitingResult()) {
                log.debug("Group {} of job {} is {}, ignoring result", group.getGroupId(), jobId,
                    group.getStatus().wireValue());
                continue;
            }
            if (result.resultKey() != null) {
                group.markSucceeded(result.resultKey());
                changed.add(group);
            } else if (result.error() != null) {
                group.markFailed(result.error());
                changed.add(group);
            }
        }

        if (request.stage() != null) {
            try {
                job.advanceStage(JobStatus.fromWireValue(request.stage()));
            } catch (IllegalArgumentException e) {
                log.warn("Callback for job {} reports unknown stage {}", jobId, request.stage());
            }
        }

        groupRepository.saveAll(groups);
        changed.forEach(group -> eventBus.append(job, GroupStatusChanged.of(group)));

        boolean runOver = groups.stream()
                .filter(CaptureGroup::isActive)
                .allMatch(group -> group.getStatus().isTerminal());
        boolean retry = false;
        if (runOver) {
            job.clearManifest(job.getManifestHash());
            dispatchMetrics.recordFinish(jobId);
            retry = groups.stream().anyMatch(group -> group.isRetryable(job.getMaxAttempts()));
            if (!retry) {
                lifecycleService.completeRun(job, groups, request.error());
            }
        }
        jobRepository.save(job);
        eventBus.publishPending(job);

        log.info("Callback for job {} updated {} groups (status {}, run over: {}, retry: {})",
            jobId, changed.size(), job.getStatus().wireValue(), runOver, retry);
        return new Outcome(new ComputeCallbackResponse(true, false, job.getStatus().wireValue(), changed.size(), retry),
            retry);
    }

    // ---- provider grouping

    private ComputeCallbackResponse applyRemoteGrouping(Job job, ComputeCallbackRequest request) {
        String jobId = job.getJobId();
        job.clearManifest(job.getManifestHash());
        if (request.error() != null) {
            job.recordRemoteGroupingFailure(request.error());
            jobRepository.save(job);
            log.warn("Provider could not group job {}: {}", jobId, request.error());
            return new ComputeCallbackResponse(true, false, job.getStatus().wireValue(), 0, false);
        }

        List<UploadedFile> allFiles = fileRepository.findByJobIdOrderByCreatedAtAsc(jobId);
        Map<String, UploadedFile> byKey = new LinkedHashMap<>();
        for (UploadedFile file : allFiles) {
            if (file.isUploadConfirmed()) {
                byKey.put(file.getStorageKey(), file);
            }
        }

        List<GroupSpec> specs = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        List<GroupResult> results = request.groups() != null ? request.groups() : List.of();
        for (GroupResult result : results) {
            List<FrameMetadata> members = new ArrayList<>();
            for (String key : result.files() != null ? result.files() : List.<String>of()) {
                UploadedFile file = byKey.get(key);
                if (file == null) {
                    log.warn("Provider grouped unknown file {} for job {}", key, jobId);
                } else if (placed.add(key)) {
                    members.add(FrameMetadata.from(file));
                }
            }
            if (!members.isEmpty()) {
                specs.add(groupingEngine.providedGroup(members, result.confidence()));
            }
        }
        for (UploadedFile file : byKey.values()) {
            if (!placed.contains(file.getStorageKey())) {
                specs.add(groupingEngine.providedGroup(List.of(FrameMetadata.from(file)), null));
            }
        }
        specs.sort((a, b) -> a.representative().filename().compareTo(b.representative().filename()));
        if (specs.isEmpty()) {
            throw new ValidationException("Provider returned no groups for job " + jobId);
        }

        GroupingResult grouping = groupWriter.replace(job, allFiles, specs);
        job.resolveInput(grouping.groups().size(), grouping.inputType(), grouping.maxConfidence());
        jobRepository.save(job);
        eventBus.append(job, new JobGrouped(jobId, grouping.fileCount(), grouping.groups().size(),
            grouping.eventItems(), Instant.now()));
        eventBus.publishPending(job);

        log.info("Job {} grouped by provider: {} files into {} groups", jobId, grouping.fileCount(),
            grouping.groups().size());
        return new ComputeCallbackResponse(true, false, job.getStatus().wireValue(), grouping.groups().size(), false);
    }

    private record Outcome(ComputeCallbackResponse response, boolean retry) {
        static Outcome done(ComputeCallbackResponse response) {
            return new Outcome(response, false);
        }
    }
}
