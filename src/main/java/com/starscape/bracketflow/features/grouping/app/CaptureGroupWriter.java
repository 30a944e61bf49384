package com.starscape.bracketflow.features.grouping.app;

import com.starscape.bracketflow.features.grouping.domain.FrameMetadata;
import com.starscape.bracketflow.features.grouping.domain.GroupSpec;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroup;
import com.starscape.bracketflow.features.jobs.domain.CaptureGroupRepository;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.jobs.domain.UploadedFileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Replaces a job's capture groups wholesale: delete every existing group, then insert the
 * new set and reassign member files. Callers hold the job row lock.
 */
@Component
public class CaptureGroupWriter {
    
    private static final Logger log = LoggerFactory.getLogger(CaptureGroupWriter.class);
    
    private final CaptureGroupRepository groupRepository;
    private final UploadedFileRepository fileRepository;
    
    public CaptureGroupWriter(CaptureGroupRepository groupRepository, UploadedFileRepository fileRepository) {
        this.groupRepository = groupRepository;
        this.fileRepository = fileRepository;
    }
    
    public GroupingResult replace(Job job, List<UploadedFile> files, List<GroupSpec> specs) {
        String jobId = job.getJobId();
        groupRepository.deleteByJobId(jobId);
        files.forEach(UploadedFile::clearGroup);
        
        Map<String, UploadedFile> byId = files.stream()
                .collect(Collectors.toMap(UploadedFile::getFileId, Function.identity()));
        List<CaptureGroup> groups = new ArrayList<>();
        Map<String, List<UploadedFile>> members = new LinkedHashMap<>();
        
        for (int index = 0; index < specs.size(); index++) {
            GroupSpec planned = specs.get(index);
            String groupId = "grp_" + UUID.randomUUID().toString().replace("-", "");
            CaptureGroup group = new CaptureGroup(
                groupId,
                jobId,
                index,
                planned.type(),
                planned.confidence(),
                planned.size(),
                planned.representative().fileId(),
                planned.representativeIndex(),
                planned.outputFilename()
            );
            List<UploadedFile> groupFiles = new ArrayList<>();
            for (int order = 0; order < planned.members().size(); order++) {
                FrameMetadata member = planned.members().get(order);
                UploadedFile file = byId.get(member.fileId());
                if (file == null) {
                    throw new IllegalStateException("File " + member.fileId() + " does not belong to job " + jobId);
                }
                if (file.getGroupId() != null) {
                    throw new IllegalStateException("File " + member.fileId() + " assigned to two groups");
                }
                file.assignToGroup(groupId, order);
                groupFiles.add(file);
            }
            groups.add(group);
            members.put(groupId, groupFiles);
        }
        
        groupRepository.saveAll(groups);
        fileRepository.saveAll(files);
        log.info("Wrote {} capture groups for job {} from {} files", groups.size(), jobId, files.size());
        return new GroupingResult(groups, members);
    }
}
