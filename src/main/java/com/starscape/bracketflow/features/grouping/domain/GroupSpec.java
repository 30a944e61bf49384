package com.starscape.bracketflow.features.grouping.domain;

import com.starscape.bracketflow.features.jobs.domain.GroupType;

import java.util.List;

/**
 * One capture group proposed by the engine, members in output order.
 *
 * @param confidence HDR confidence in [0, 1], or null when the members were never scored together
 */
public record GroupSpec(
    GroupType type,
    List<FrameMetadata> members,
    Double confidence,
    String outputFilename,
    int representativeIndex
) {
    
    public GroupSpec {
        members = List.copyOf(members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A capture group needs at least one member");
        }
    }
    
    public FrameMetadata representative() {
        return members.get(representativeIndex);
    }
    
    public int size() {
        return members.size();
    }
}
