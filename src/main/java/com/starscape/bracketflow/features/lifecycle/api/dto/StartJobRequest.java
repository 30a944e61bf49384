package com.starscape.bracketflow.features.lifecycle.api.dto;

import java.util.List;

/**
 * {@code skipGroupIds} replaces the current skip selection; {@code null} keeps it.
 */
public record StartJobRequest(
    List<String> skipGroupIds
) {}
