package com.starscape.bracketflow.features.grouping.app;

import com.starscape.bracketflow.features.jobs.domain.CaptureGroup;
import com.starscape.bracketflow.features.jobs.domain.GroupType;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups written by one grouping run, with their member files in output order.
 */
public record GroupingResult(List<CaptureGroup> groups, Map<String, List<UploadedFile>> members) {
    
    public int hdrGroupCount() {
        return (int) groups.stream().filter(g -> g.getGroupType() == GroupType.HDR).count();
    }
    
    /**
     * {@code hdr} when any bracket was found, otherwise the dominant singleton kind.
     */
    public String inputType() {
        if (hdrGroupCount() > 0) {
            return GroupType.HDR.wireValue();
        }
        if (groups.stream().anyMatch(g -> g.getGroupType() == GroupType.GROUP)) {
            return GroupType.GROUP.wireValue();
        }
        if (groups.stream().anyMatch(g -> g.getGroupType() == GroupType.RAW)) {
            return GroupType.RAW.wireValue();
        }
        return GroupType.IMAGE.wireValue();
    }
    
    public Double maxConfidence() {
        return groups.stream()
                .map(CaptureGroup::getHdrConfidence)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }
    
    public int fileCount() {
        return members.values().stream().mapToInt(List::size).sum();
    }
    
    public List<String> frameNames(String groupId) {
        return members.getOrDefault(groupId, List.of()).stream()
                .map(UploadedFile::getFilename)
                .toList();
    }
    
    /**
     * Per-group summaries carried by the {@code grouped} event.
     */
    public List<Map<String, Object>> eventItems() {
        List<Map<String, Object>> items = new ArrayList<>();
        for (CaptureGroup group : groups) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("group_id", group.getGroupId());
            item.put("index", group.getGroupIndex());
            item.put("type", group.getGroupType().wireValue());
            item.put("status", group.getStatus().wireValue());
            item.put("confidence", group.getHdrConfidence());
            item.put("size", group.getGroupSize());
            item.put("output_filename", group.getOutputFilename());
            item.put("representative_index", group.getRepresentativeIndex());
            item.put("frames", frameNames(group.getGroupId()));
            items.add(item);
        }
        return items;
    }
}
