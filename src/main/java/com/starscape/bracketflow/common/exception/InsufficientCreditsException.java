package com.starscape.bracketflow.common.exception;

public class InsufficientCreditsException extends BusinessException {
    
    private final long requested;
    private final long available;
    
    public InsufficientCreditsException(long requested, long available) {
        super("INSUFFICIENT_CREDITS",
            String.format("Insufficient credits: requested %d, available %d", requested, available));
        this.requested = requested;
        this.available = available;
    }
    
    public long getRequested() {
        return requested;
    }
    
    public long getAvailable() {
        return available;
    }
}
