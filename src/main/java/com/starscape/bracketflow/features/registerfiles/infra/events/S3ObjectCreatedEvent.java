package com.starscape.bracketflow.features.registerfiles.infra.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * EventBridge envelope of an S3 notification, reduced to what upload confirmation reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record S3ObjectCreatedEvent(
    @JsonProperty("id") String id,
    @JsonProperty("detail-type") String detailType,
    @JsonProperty("detail") Detail detail
) {
    
    public static final String OBJECT_CREATED = "Object Created";
    
    public boolean isObjectCreated() {
        return OBJECT_CREATED.equals(detailType) && detail != null && detail.object() != null;
    }
    
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Detail(
        @JsonProperty("bucket") Bucket bucket,
        @JsonProperty("object") StoredObject object
    ) {}
    
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Bucket(
        @JsonProperty("name") String name
    ) {}
    
    /**
     * {@code key} arrives URL-encoded, as S3 sends it.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StoredObject(
        @JsonProperty("key") String key,
        @JsonProperty("size") long size
    ) {}
}
