package com.starscape.bracketflow.features.registerfiles.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.bracketflow.features.registerfiles.app.UploadConfirmationService;
import com.starscape.bracketflow.features.registerfiles.infra.events.S3ObjectCreatedEvent;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Confirms uploads from S3 ObjectCreated notifications routed through EventBridge to SQS.
 * <p>
 * Only enabled when spring.cloud.aws.sqs.enabled=true and aws.sqs.queue-url is configured.
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "true", matchIfMissing = false)
public class S3UploadEventListener {
    
    private static final Logger log = LoggerFactory.getLogger(S3UploadEventListener.class);
    
    private final UploadConfirmationService confirmationService;
    private final ObjectMapper objectMapper;
    private final String bucket;
    
    public S3UploadEventListener(
            UploadConfirmationService confirmationService,
            ObjectMapper objectMapper,
            @Value("${aws.s3.bucket}") String bucket) {
        this.confirmationService = confirmationService;
        this.objectMapper = objectMapper;
        this.bucket = bucket;
    }
    
    /**
     * A message that cannot be parsed or confirmed is rethrown so SQS redelivers it
     * and eventually moves it to the dead-letter queue.
     */
    @SqsListener("${aws.sqs.queue-url}")
    public void handleS3Event(String message) {
        log.debug("Received SQS message: {}", message);
        
        S3ObjectCreatedEvent event;
        try {
            event = objectMapper.readValue(message, S3ObjectCreatedEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse S3 event message", e);
            throw new IllegalArgumentException("Invalid S3 event message", e);
        }
        
        if (!event.isObjectCreated()) {
            log.warn("Ignoring non-ObjectCreated event: {}", event.detailType());
            return;
        }
        if (event.detail().bucket() != null && !bucket.equals(event.detail().bucket().name())) {
            log.warn("Ignoring object from unexpected bucket {}", event.detail().bucket().name());
            return;
        }
        
        String key = URLDecoder.decode(event.detail().object().key(), StandardCharsets.UTF_8);
        // manifests are written by this service under the same bucket
        if (key.contains("/manifests/")) {
            log.debug("Skipping manifest object: {}", key);
            return;
        }
        confirmationService.confirm(key, event.detail().object().size());
    }
}
