package com.starscape.bracketflow.common.exception;

public class CallbackAuthenticationException extends BusinessException {
    
    public CallbackAuthenticationException() {
        super("UNAUTHORIZED", "Invalid callback secret");
    }
}
