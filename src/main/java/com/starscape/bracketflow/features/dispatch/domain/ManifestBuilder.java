package com.starscape.bracketflow.features.dispatch.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.bracketflow.features.jobs.domain.ProcessingMode;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds manifests whose hash depends only on the set of storage keys and the mode.
 */
public final class ManifestBuilder {
    
    private static final ObjectMapper CANONICAL = new ObjectMapper();
    
    private ManifestBuilder() {
    }
    
    public static Manifest build(Collection<String> storageKeys, ProcessingMode mode) {
        List<String> files = new ArrayList<>(new TreeSet<>(storageKeys));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("files", files);
        body.put("mode", mode.wireValue());
        try {
            String json = CANONICAL.writeValueAsString(body);
            return new Manifest(files, mode, DigestUtils.sha256Hex(json), json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize manifest", e);
        }
    }
}
