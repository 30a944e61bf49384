package com.starscape.bracketflow.features.dispatch.domain;

import com.starscape.bracketflow.features.jobs.domain.ProcessingMode;

import java.util.List;

/**
 * Content-addressed description of one dispatch: the sorted storage keys and the mode.
 *
 * @param canonicalJson exact bytes the hash was computed over
 */
public record Manifest(List<String> files, ProcessingMode mode, String hash, String canonicalJson) {
    
    public Manifest {
        files = List.copyOf(files);
    }
    
    public int size() {
        return files.size();
    }
}
