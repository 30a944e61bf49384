package com.starscape.bracketflow.features.credits.domain;

/**
 * Ledger keys derived from the job and the logical action, never from time or randomness.
 * Reservation rounds make a second reservation for the same job distinct from the first.
 */
public final class IdempotencyKeys {
    
    private IdempotencyKeys() {
    }
    
    public static String reserve(String jobId, int round) {
        return round <= 0 ? "reserve:" + jobId : "reserve:" + jobId + ":" + round;
    }
    
    public static String retryReserve(String jobId, int round) {
        return "reserve:" + jobId + ":retry:" + round;
    }
    
    public static String resumeReserve(String jobId, int round) {
        return "reserve:" + jobId + ":resume:" + round;
    }
    
    public static String dispatchFailedRelease(String jobId, int round) {
        return "release:" + jobId + ":" + round + ":dispatch_failed";
    }
    
    public static String cancelRelease(String jobId) {
        return "release:" + jobId + ":cancel";
    }
    
    public static String settle(String jobId) {
        return "settle:" + jobId;
    }
    
    public static String settleRemainderRelease(String jobId) {
        return "release:" + jobId + ":settle";
    }
}
