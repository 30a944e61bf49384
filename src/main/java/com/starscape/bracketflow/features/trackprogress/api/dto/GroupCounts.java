package com.starscape.bracketflow.features.trackprogress.api.dto;

/**
 * @param total active groups, skipped ones excluded
 * @param totalIncludingSkipped every group of the current grouping run
 */
public record GroupCounts(
    int total,
    int succeeded,
    int failed,
    int skipped,
    int totalIncludingSkipped
) {}
