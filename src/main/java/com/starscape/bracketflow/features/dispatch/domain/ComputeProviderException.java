package com.starscape.bracketflow.features.dispatch.domain;

/**
 * Thrown when the compute provider returns an error or is unreachable.
 */
public class ComputeProviderException extends RuntimeException {
    
    public ComputeProviderException(String message) {
        super(message);
    }
    
    public ComputeProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
