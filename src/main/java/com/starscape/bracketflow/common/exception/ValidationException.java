package com.starscape.bracketflow.common.exception;

/**
 * Malformed or missing input. Reported to the caller and never retried.
 */
public class ValidationException extends BusinessException {
    
    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
