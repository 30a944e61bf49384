package com.starscape.bracketflow.common.exception;

/**
 * The compute provider could not accept a dispatch. Callers may retry the same action.
 */
public class ExternalDispatchException extends BusinessException {
    
    public ExternalDispatchException(String message, Throwable cause) {
        super("DISPATCH_FAILED", message, cause);
    }
}
