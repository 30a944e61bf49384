package com.starscape.bracketflow.features.trackprogress.app;

import com.starscape.bracketflow.features.jobs.app.JobLookup;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroup;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroupRepository;
import com.starscape.bracketflow.features.jobs.domain.GroupStatus;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.jobs.domain.UploadedFileRepository;
import com.starscape.bracketflow.features.trackprogress.api.dto.GroupCounts;
import com.starscape.bracketflow.features.trackprogress.api.dto.GroupStatusItem;
import com.starscape.bracketflow.features.trackprogress.api.dto.JobStatusResponse;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Handler for retrieving job status.
 * Returns job information with per-group detail and aggregated progress.
 */
@Service
public class GetJobStatusHandler {
    
    private final JobLookup jobLookup;
    private final CaptureGroupRepository groupRepository;
    private final UploadedFileRepository fileRepository;
    
    public GetJobStatusHandler(
            JobLookup jobLookup,
            CaptureGroupRepository groupRepository,
            UploadedFileRepository fileRepository) {
        this.jobLookup = jobLookup;
        this.groupRepository = groupRepository;
        this.fileRepository = fileRepository;
    }
    
    @Transactional(readOnly = true)
    public JobStatusResponse handle(String jobId, String userId) {
        Job job = jobLookup.requireOwned(jobId, userId);
        List<CaptureGroup> groups = groupRepository.findByJobIdOrderByGroupIndexAsc(jobId);
        
        Map<String, List<UploadedFile>> framesByGroup = fileRepository.findByJobIdOrderByCreatedAtAsc(jobId).stream()
                .filter(file -> file.getGroupId() != null)
                .sorted(Comparator.comparing(UploadedFile::getGroupOrder, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.groupingBy(UploadedFile::getGroupId));
        
        List<GroupStatusItem> items = groups.stream()
                .map(group -> new GroupStatusItem(
                    group.getGroupId(),
                    group.getGroupIndex(),
                    group.getGroupType().wireValue(),
                    group.getStatus().wireValue(),
                    group.getHdrConfidence(),
                    group.getOutputFilename(),
                    group.getGroupSize(),
                    group.getRepresentativeIndex(),
                    framesByGroup.getOrDefault(group.getGroupId(), List.of()).stream()
                        .map(UploadedFile::getFilename)
                        .toList(),
                    group.getAttempts(),
                    group.getLastError(),
                    group.getResultKey()
                ))
                .toList();
        
        GroupCounts counts = countGroups(groups);
        
        return new JobStatusResponse(
            job.getJobId(),
            job.getStatus().wireValue(),
            job.getWorkflowId(),
            job.getProjectName(),
            job.getInputType(),
            job.getHdrConfidence(),
            job.getProcessingMode() != null ? job.getProcessingMode().wireValue() : null,
            job.getEstimatedUnits(),
            job.getReservedUnits(),
            job.getSettledUnits(),
            counts,
            progress(counts),
            job.getLastEventSequence(),
            job.getErrorMessage(),
            items,
            job.getCreatedAt(),
            job.getUpdatedAt(),
            job.getFinishedAt()
        );
    }
    
    static GroupCounts countGroups(List<CaptureGroup> groups) {
        int skipped = (int) groups.stream().filter(g -> g.getStatus() == GroupStatus.SKIPPED).count();
        int succeeded = (int) groups.stream().filter(g -> g.getStatus() == GroupStatus.SUCCEEDED).count();
        int failed = (int) groups.stream().filter(g -> g.getStatus() == GroupStatus.FAILED).count();
        return new GroupCounts(groups.size() - skipped, succeeded, failed, skipped, groups.size());
    }
    
    static int progress(GroupCounts counts) {
        if (counts.total() == 0) {
            return 0;
        }
        return (int) Math.round((counts.succeeded() + counts.failed()) * 100.0 / counts.total());
    }
}
