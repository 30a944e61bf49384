package com.starscape.bracketflow.features.dispatch.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.bracketflow.common.config.DispatchProperties;
import com.starscape.bracketflow.features.dispatch.domain.Manifest;
import com.starscape.bracketflow.features.dispatch.domain.ManifestStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes manifests to {@code {prefix}/{jobId}/manifests/{millis}-{uuid}.json}.
 * Every write gets a fresh key, so a superseded manifest is never overwritten.
 */
@Component
public class S3ManifestStore implements ManifestStore {
    
    private static final Logger log = LoggerFactory.getLogger(S3ManifestStore.class);
    
    private final S3Client s3Client;
    private final ObjectMapper objectMapper;
    private final String bucket;
    private final String prefix;
    
    public S3ManifestStore(
            S3Client s3Client,
            ObjectMapper objectMapper,
            DispatchProperties dispatchProperties,
            @Value("${aws.s3.bucket}") String bucket) {
        this.s3Client = s3Client;
        this.objectMapper = objectMapper;
        this.bucket = bucket;
        this.prefix = dispatchProperties.getManifestPrefix();
    }
    
    @Override
    public String store(String jobId, Manifest manifest) {
        String key = String.format("%s/%s/manifests/%d-%s.json",
            prefix, jobId, System.currentTimeMillis(), UUID.randomUUID());
        
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("job_id", jobId);
        document.put("manifest_hash", manifest.hash());
        document.put("mode", manifest.mode().wireValue());
        document.put("files", manifest.files());
        document.put("created_at", Instant.now().toString());
        
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize manifest for job " + jobId, e);
        }
        
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType("application/json")
                .contentLength((long) body.length)
                .build();
        s3Client.putObject(putRequest, RequestBody.fromBytes(body));
        
        log.info("Stored manifest {} for job {} ({} files, hash {})", key, jobId, manifest.size(), manifest.hash());
        return key;
    }
}
