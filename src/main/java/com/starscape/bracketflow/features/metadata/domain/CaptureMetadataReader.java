package com.starscape.bracketflow.features.metadata.domain;

import java.io.IOException;

/**
 * Reads capture metadata from a stored original.
 */
public interface CaptureMetadataReader {
    
    CaptureMetadata read(String storageKey) throws IOException;
}
