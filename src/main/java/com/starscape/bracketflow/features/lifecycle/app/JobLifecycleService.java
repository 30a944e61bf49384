package com.starscape.bracketflow.features.lifecycle.app;

import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.features.credits.domain.CreditLedgerGateway;
import com.starscape.bracketflow.features.credits.domain.IdempotencyKeys;
import com.starscape.bracketflow.features.dispatch.app.DispatchCoordinator;
import com.starscape.bracketflow.features.dispatch.app.DispatchMetrics;
import com.starscape.bracketflow.features.dispatch.domain.DispatchResult;
import com.starscape.bracketflow.features.jobs.app.JobLookup;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroup;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroupRepository;
import com.starscape.bracketflow.features.jobs.domain.GroupStatus;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobRepository;
import com.starscape.bracketflow.features.jobs.domain.JobStatus;
import com.starscape.bracketflow.features.jobs.domain.ProcessingMode;
import com.starscape.bracketflow.features.jobs.domain.events.GroupStatusChanged;
import com.starscape.bracketflow.features.lifecycle.api.dto.JobActionResponse;
import com.starscape.bracketflow.features.trackprogress.app.JobEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * User and system actions that move a job through reservation, dispatch and settlement.
 * <p>
 * Every action that dispatches follows the same order: reserve under the job lock, call
 * the provider with no transaction open, then either mark the job dispatched or release
 * what this action reserved and put the job and its groups back where they were.
 */
@Service
public class JobLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(JobLifecycleService.class);

    static final String CANCELED_REASON = "Canceled by user";

    private final JobLookup jobLookup;
    private final JobRepository jobRepository;
    private final CaptureGroupRepository groupRepository;
    private final CreditLedgerGateway creditLedger;
    private final DispatchCoordinator dispatchCoordinator;
    private final DispatchMetrics dispatchMetrics;
    private final JobEventBus eventBus;
    private final TransactionOperations transactionOperations;

    public JobLifecycleService(
            JobLookup jobLookup,
            JobRepository jobRepository,
            CaptureGroupRepository groupRepository,
            CreditLedgerGateway creditLedger,
            DispatchCoordinator dispatchCoordinator,
            DispatchMetrics dispatchMetrics,
            JobEventBus eventBus,
            TransactionOperations transactionOperations) {
        this.jobLookup = jobLookup;
        this.jobRepository = jobRepository;
        this.groupRepository = groupRepository;
        this.creditLedger = creditLedger;
        this.dispatchCoordinator = dispatchCoordinator;
        this.dispatchMetrics = dispatchMetrics;
        this.eventBus = eventBus;
        this.transactionOperations = transactionOperations;
    }

    // ---- start

    /**
     * Reserves credits for the active groups and dispatches them. Calling again while the
     * job is already reserved or processing with the same selection changes nothing.
     */
    public JobActionResponse start(String jobId, String userId, List<String> skipGroupIds) {
        Plan plan = transactionOperations.execute(status -> planStart(jobId, userId, skipGroupIds));
        if (plan.noop()) {
            log.info("Start of job {} is a no-op in status {}", jobId, plan.previousStatus().wireValue());
            return describe(jobId, null, false);
        }
        return dispatch(plan);
    }

    private Plan planStart(String jobId, String userId, List<String> skipGroupIds) {
        Job job = jobLookup.lockOwned(jobId, userId);
        List<CaptureGroup> groups = groupRepository.findByJobIdOrderByGroupIndexAsc(jobId);
        Set<String> requestedSkips = skipGroupIds == null ? null : new HashSet<>(skipGroupIds);
        if (requestedSkips != null) {
            Set<String> known = groups.stream().map(CaptureGroup::getGroupId).collect(Collectors.toSet());
            for (String groupId : requestedSkips) {
                if (!known.contains(groupId)) {
                    throw new ValidationException("Group " + groupId + " does not belong to job " + jobId);
                }
            }
        }

        if (job.getStatus() == JobStatus.INPUT_RESOLVED) {
            return planFreshStart(job, groups, requestedSkips);
        }
        if (job.getStatus().isProcessing()) {
            return planResume(job, groups, requestedSkips);
        }
        throw new IllegalStateException("Cannot start job in status " + job.getStatus().wireValue());
    }

    private Plan planFreshStart(Job job, List<CaptureGroup> groups, Set<String> requestedSkips) {
        if (groups.isEmpty()) {
            throw new ValidationException("Job " + job.getJobId() + " has no capture groups");
        }
        List<CaptureGroup> changed = new ArrayList<>();
        if (requestedSkips != null) {
            for (CaptureGroup group : groups) {
                GroupStatus before = group.getStatus();
                if (requestedSkips.contains(group.getGroupId())) {
                    if (before != GroupStatus.QUEUED && before != GroupStatus.SKIPPED) {
                        throw new ValidationException("Group " + group.getGroupId() + " cannot be skipped in status "
                            + before.wireValue());
                    }
                    group.skip();
                } else if (before == GroupStatus.SKIPPED) {
                    group.requeue();
                }
                if (group.getStatus() != before) {
                    changed.add(group);
                }
            }
        }

        List<CaptureGroup> active = groups.stream().filter(CaptureGroup::isActive).toList();
        if (active.isEmpty()) {
            throw new ValidationException("At least one group must stay active");
        }

        int units = active.size();
        int round = job.getReservationRound();
        creditLedger.reserve(job.getUserId(), job.getJobId(), job.creditsFor(units),
            IdempotencyKeys.reserve(job.getJobId(), round));

        active.forEach(CaptureGroup::resetForStart);
        job.beginDispatch(units);
        groupRepository.saveAll(groups);
        jobRepository.save(job);
        changed.forEach(group -> eventBus.append(job, GroupStatusChanged.of(group)));
        eventBus.publishPending(job);

        log.info("Reserved {} units for job {} ({} active, {} skipped)", units, job.getJobId(),
            active.size(), groups.size() - active.size());
        return Plan.of(job.getJobId(), JobStatus.INPUT_RESOLVED, units, round, ids(active), Map.of());
    }

    /**
     * Once processing has started the selection can only shrink the skip list.
     */
    private Plan planResume(Job job, List<CaptureGroup> groups, Set<String> requestedSkips) {
        Set<String> currentSkips = groups.stream()
                .filter(group -> group.getStatus() == GroupStatus.SKIPPED)
                .map(CaptureGroup::getGroupId)
                .collect(Collectors.toSet());
        if (requestedSkips == null || requestedSkips.equals(currentSkips)) {
            return Plan.noop(job.getJobId(), job.getStatus());
        }
        if (job.getStatus() == JobStatus.RESERVED) {
            throw new IllegalStateException("Job " + job.getJobId() + " is being dispatched; try again shortly");
        }
        for (String groupId : requestedSkips) {
            if (!currentSkips.contains(groupId)) {
                throw new IllegalStateException("Cannot skip group " + groupId + " after processing has started");
            }
        }

        List<CaptureGroup> resumed = groups.stream()
                .filter(group -> currentSkips.contains(group.getGroupId()) && !requestedSkips.contains(group.getGroupId()))
                .toList();
        int units = resumed.size();
        int round = job.getReservationRound();
        creditLedger.reserve(job.getUserId(), job.getJobId(), job.creditsFor(units),
            IdempotencyKeys.resumeReserve(job.getJobId(), round));

        Map<String, Snapshot> previous = snapshot(resumed);
        JobStatus previousStatus = job.getStatus();
        resumed.forEach(CaptureGroup::resetForStart);
        job.beginDispatch(units);
        groupRepository.saveAll(resumed);
        jobRepository.save(job);
        resumed.forEach(group -> eventBus.append(job, GroupStatusChanged.of(group)));
        eventBus.publishPending(job);

        log.info("Resuming {} skipped groups of job {} with {} more units", units, job.getJobId(), units);
        return Plan.of(job.getJobId(), previousStatus, units, round, ids(resumed), previous);
    }

    // ---- retry

    public JobActionResponse retryMissing(String jobId, String userId) {
        Plan plan = transactionOperations.execute(status -> planRetry(jobLookup.lockOwned(jobId, userId)));
        return dispatch(plan);
    }

    /**
     * Retry triggered by a callback that left retryable groups behind.
     */
    public JobActionResponse retryAutomatically(String jobId) {
        Plan plan = transactionOperations.execute(status -> planRetry(jobLookup.lock(jobId)));
        log.info("Automatically retrying {} groups of job {}", plan.groupIds().size(), jobId);
        return dispatch(plan);
    }

    private Plan planRetry(Job job) {
        String jobId = job.getJobId();
        if (!job.getStatus().isProcessing() || job.getStatus() == JobStatus.RESERVED) {
            throw new IllegalStateException("Cannot retry job in status " + job.getStatus().wireValue());
        }
        List<CaptureGroup> retryable = groupRepository.findByJobIdOrderByGroupIndexAsc(jobId).stream()
                .filter(group -> group.isRetryable(job.getMaxAttempts()))
                .toList();
        if (retryable.isEmpty()) {
            throw new IllegalStateException("Job " + jobId + " has no failed groups left to retry");
        }

        int round = job.getReservationRound();
        int units = 0;
        if (job.getReservedUnits() <= 0) {
            units = retryable.size();
            creditLedger.reserve(job.getUserId(), jobId, job.creditsFor(units), IdempotencyKeys.retryReserve(jobId, round));
        }

        Map<String, Snapshot> previous = snapshot(retryable);
        JobStatus previousStatus = job.getStatus();
        retryable.forEach(CaptureGroup::requeue);
        job.beginDispatch(units);
        groupRepository.saveAll(retryable);
        jobRepository.save(job);
        retryable.forEach(group -> eventBus.append(job, GroupStatusChanged.of(group)));
        eventBus.publishPending(job);

        log.info("Requeued {} failed groups of job {} (additional units: {})", retryable.size(), jobId, units);
        return Plan.of(jobId, previousStatus, units, round, ids(retryable), previous);
    }

    // ---- dispatch and compensation

    private JobActionResponse dispatch(Plan plan) {
        DispatchResult result;
        try {
            result = dispatchCoordinator.dispatch(plan.jobId(), ProcessingMode.FULL);
        } catch (RuntimeException e) {
            compensate(plan, e);
            throw e;
        }

        boolean terminal = Boolean.TRUE.equals(transactionOperations.execute(status -> {
            Job job = jobLookup.lock(plan.jobId());
            job.markDispatched();
            List<CaptureGroup> groups = groupRepository.findByJobIdOrderByGroupIndexAsc(plan.jobId());
            for (CaptureGroup group : groups) {
                if (plan.groupIds().contains(group.getGroupId()) && group.getStatus() == GroupStatus.QUEUED) {
                    group.markProcessing();
                    eventBus.append(job, GroupStatusChanged.of(group));
                }
            }
            groupRepository.saveAll(groups);
            jobRepository.save(job);
            eventBus.publishPending(job);
            return job.getStatus().isTerminal();
        }));
        if (terminal) {
            // canceled while the provider call was in flight
            dispatchMetrics.forget(plan.jobId());
        }
        return describe(plan.jobId(), result, true);
    }

    /**
     * Releases what the failed action reserved and restores the job and its groups.
     * Skipped when the job left {@code reserved} in the meantime (a cancel already released).
     */
    private void compensate(Plan plan, RuntimeException cause) {
        try {
            transactionOperations.executeWithoutResult(status -> {
                Job job = jobLookup.lock(plan.jobId());
                if (job.getStatus() != JobStatus.RESERVED) {
                    log.warn("Job {} is {} after a failed dispatch, nothing to revert",
                        plan.jobId(), job.getStatus().wireValue());
                    return;
                }
                if (plan.units() > 0) {
                    creditLedger.release(job.getUserId(), plan.jobId(), job.creditsFor(plan.units()),
                        IdempotencyKeys.dispatchFailedRelease(plan.jobId(), plan.round()));
                }
                job.revertDispatch(plan.previousStatus(), plan.units(), cause.getMessage());

                List<CaptureGroup> groups = groupRepository.findByJobIdOrderByGroupIndexAsc(plan.jobId());
                for (CaptureGroup group : groups) {
                    Snapshot snapshot = plan.previous().get(group.getGroupId());
                    if (snapshot != null && group.getStatus() == GroupStatus.QUEUED) {
                        group.restore(snapshot.status(), snapshot.error());
                        eventBus.append(job, GroupStatusChanged.of(group));
                    }
                }
                groupRepository.saveAll(groups);
                jobRepository.save(job);
                eventBus.publishPending(job);
                log.info("Reverted job {} to {} after failed dispatch, released {} units",
                    plan.jobId(), plan.previousStatus().wireValue(), plan.units());
            });
        } catch (RuntimeException e) {
            log.error("Could not revert job {} after failed dispatch", plan.jobId(), e);
            cause.addSuppressed(e);
        }
    }

    // ---- cancel

    /**
     * Releases any outstanding reservation and fails every unfinished group. A job that
     * is already terminal is returned unchanged.
     */
    public JobActionResponse cancel(String jobId, String userId) {
        boolean changed = Boolean.TRUE.equals(transactionOperations.execute(status -> {
            Job job = jobLookup.lockOwned(jobId, userId);
            if (job.getStatus().isTerminal()) {
                return false;
            }
            if (job.getReservedUnits() > 0) {
                creditLedger.release(userId, jobId, job.creditsFor(job.getReservedUnits()),
                    IdempotencyKeys.cancelRelease(jobId));
            }
            int released = job.cancel();

            List<CaptureGroup> groups = groupRepository.findByJobIdOrderByGroupIndexAsc(jobId);
            for (CaptureGroup group : groups) {
                if (!group.getStatus().isTerminal()) {
                    group.abandon(CANCELED_REASON);
                    eventBus.append(job, GroupStatusChanged.of(group));
                }
            }
            groupRepository.saveAll(groups);
            jobRepository.save(job);
            eventBus.publishPending(job);
            log.info("Canceled job {}, released {} units", jobId, released);
            return true;
        }));
        if (changed) {
            dispatchMetrics.forget(jobId);
        }
        return describe(jobId, null, changed);
    }

    // ---- remote grouping

    /**
     * Sends every uploaded file to the provider for grouping. No credits are involved;
     * the groups arrive with the callback.
     */
    public JobActionResponse requestRemoteGrouping(String jobId, String userId) {
        transactionOperations.executeWithoutResult(status -> {
            Job job = jobLookup.lockOwned(jobId, userId);
            job.awaitRemoteGrouping();
            jobRepository.save(job);
            eventBus.publishPending(job);
        });
        DispatchResult result = dispatchCoordinator.dispatch(jobId, ProcessingMode.GROUP);
        log.info("Job {} waits for provider grouping under {}", jobId, result.executionHandle());
        return describe(jobId, result, !result.reused());
    }

    // ---- settlement

    /**
     * Settles a job whose active groups are all terminal: succeeded units are spent, the
     * rest of the reservation goes back to the user. Callers hold the job row lock.
     */
    public void completeRun(Job job, List<CaptureGroup> groups, String runError) {
        String jobId = job.getJobId();
        int succeeded = 0;
        int failed = 0;
        for (CaptureGroup group : groups) {
            if (group.getStatus() == GroupStatus.SUCCEEDED) {
                succeeded++;
            } else if (group.getStatus() == GroupStatus.FAILED) {
                failed++;
            }
        }
        int reserved = job.getReservedUnits();
        int settleUnits = Math.min(succeeded, reserved);
        int releaseUnits = reserved - settleUnits;
        if (settleUnits > 0) {
            creditLedger.settle(job.getUserId(), jobId, job.creditsFor(settleUnits), IdempotencyKeys.settle(jobId));
        }
        if (releaseUnits > 0) {
            creditLedger.release(job.getUserId(), jobId, job.creditsFor(releaseUnits),
                IdempotencyKeys.settleRemainderRelease(jobId));
        }

        String error = runError;
        if (error == null && failed > 0) {
            error = failed + " of " + (succeeded + failed) + " groups failed";
        }
        job.finish(succeeded, failed, settleUnits, error);
        log.info("Job {} finished as {}: {} succeeded, {} failed, settled {} units, released {}",
            jobId, job.getStatus().wireValue(), succeeded, failed, settleUnits, releaseUnits);
    }

    // ---- helpers

    private JobActionResponse describe(String jobId, DispatchResult result, boolean changed) {
        return transactionOperations.execute(status -> {
            Job job = jobRepository.findById(jobId).orElseThrow();
            List<CaptureGroup> groups = groupRepository.findByJobIdOrderByGroupIndexAsc(jobId);
            int skipped = (int) groups.stream().filter(group -> group.getStatus() == GroupStatus.SKIPPED).count();
            return new JobActionResponse(
                jobId,
                job.getStatus().wireValue(),
                groups.size() - skipped,
                skipped,
                job.getReservedUnits(),
                result != null ? result.executionHandle() : job.getExecutionHandle(),
                result != null ? result.manifestHash() : job.getManifestHash(),
                result != null && result.reused(),
                result != null ? result.queuePending() : null,
                result != null ? result.etaSeconds() : null,
                changed
            );
        });
    }

    private static Set<String> ids(List<CaptureGroup> groups) {
        return groups.stream().map(CaptureGroup::getGroupId).collect(Collectors.toSet());
    }

    private static Map<String, Snapshot> snapshot(List<CaptureGroup> groups) {
        Map<String, Snapshot> snapshots = new LinkedHashMap<>();
        for (CaptureGroup group : groups) {
            snapshots.put(group.getGroupId(), new Snapshot(group.getStatus(), group.getLastError()));
        }
        return snapshots;
    }

    private record Snapshot(GroupStatus status, String error) {
    }

    /**
     * What one action reserved and changed, kept so a failed dispatch can be undone.
     */
    private record Plan(
        String jobId,
        boolean noop,
        JobStatus previousStatus,
        int units,
        int round,
        Set<String> groupIds,
        Map<String, Snapshot> previous
    ) {
        static Plan of(String jobId, JobStatus previousStatus, int units, int round,
                       Set<String> groupIds, Map<String, Snapshot> previous) {
            return new Plan(jobId, false, previousStatus, units, round, groupIds, previous);
        }

        static Plan noop(String jobId, JobStatus status) {
            return new Plan(jobId, true, status, 0, 0, Set.of(), Map.of());
        }
    }
}
