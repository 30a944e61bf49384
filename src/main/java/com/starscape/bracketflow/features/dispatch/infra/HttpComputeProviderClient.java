package com.starscape.bracketflow.features.dispatch.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.bracketflow.common.config.DispatchProperties;
import com.starscape.bracketflow.features.dispatch.domain.ComputeProviderClient;
import com.starscape.bracketflow.features.dispatch.domain.ComputeProviderException;
import com.starscape.bracketflow.features.dispatch.domain.ComputeSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the compute provider's run endpoint.
 * <p>
 * {@code POST {providerUrl}/runs} with the manifest reference; the response carries the
 * execution handle as {@code execution_id}. Every request is bounded by the configured
 * timeout and a timeout counts as a failed dispatch.
 */
@Component
public class HttpComputeProviderClient implements ComputeProviderClient {
    
    private static final Logger log = LoggerFactory.getLogger(HttpComputeProviderClient.class);
    
    private final HttpClient http;
    private final ObjectMapper json;
    private final DispatchProperties properties;
    
    public HttpComputeProviderClient(DispatchProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.json = objectMapper;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(properties.getConnectTimeout())
                .build();
    }
    
    @Override
    public String submit(ComputeSubmission submission) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", submission.jobId());
        body.put("workflow_id", submission.workflowId());
        body.put("manifest_key", submission.manifestKey());
        body.put("manifest_hash", submission.manifestHash());
        body.put("mode", submission.mode());
        body.put("file_count", submission.fileCount());
        body.put("callback_url", submission.callbackUrl());
        
        String responseBody = post("/runs", toJson(body), "submit job " + submission.jobId());
        try {
            JsonNode node = json.readTree(responseBody);
            JsonNode handle = node.hasNonNull("execution_id") ? node.get("execution_id") : node.get("executionHandle");
            if (handle == null || handle.isNull() || handle.asText().isBlank()) {
                throw new ComputeProviderException("Provider response for job " + submission.jobId()
                    + " has no execution id: " + responseBody);
            }
            log.info("Provider accepted job {} as execution {}", submission.jobId(), handle.asText());
            return handle.asText();
        } catch (JsonProcessingException e) {
            throw new ComputeProviderException("Failed to parse provider response for job " + submission.jobId(), e);
        }
    }
    
    private String post(String path, String body, String context) {
        Duration timeout = properties.getRequestTimeout();
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getProviderUrl() + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (properties.getProviderApiKey() != null && !properties.getProviderApiKey().isBlank()) {
            request.header("Authorization", "Bearer " + properties.getProviderApiKey());
        }
        try {
            HttpResponse<String> response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new ComputeProviderException(context + " failed: HTTP " + response.statusCode() + ": " + response.body());
            }
            return response.body();
        } catch (IOException e) {
            throw new ComputeProviderException(context + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputeProviderException(context + " interrupted", e);
        }
    }
    
    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize provider request", e);
        }
    }
}
