package com.starscape.bracketflow.common.exception;

public class NotFoundException extends BusinessException {
    
    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
