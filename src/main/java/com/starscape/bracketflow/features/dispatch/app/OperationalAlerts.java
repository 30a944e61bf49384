package com.starscape.bracketflow.features.dispatch.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Operator-facing alerts. Each line carries a stable key that log-based alerting matches on.
 */
@Component
public class OperationalAlerts {
    
    private static final Logger log = LoggerFactory.getLogger(OperationalAlerts.class);
    
    public static final String QUEUE_BACKLOG = "dispatch.queue_backlog";
    public static final String ETA_EXCEEDED = "dispatch.eta_exceeded";
    public static final String DISPATCH_FAILED = "dispatch.failed";
    
    public void queueBacklog(int pending, int threshold) {
        log.warn("[ALERT {}] {} dispatches pending (threshold {})", QUEUE_BACKLOG, pending, threshold);
    }
    
    public void etaExceeded(String jobId, long etaSeconds, int thresholdSeconds) {
        log.warn("[ALERT {}] job {} estimated to wait {}s (threshold {}s)", ETA_EXCEEDED, jobId, etaSeconds, thresholdSeconds);
    }
    
    public void dispatchFailed(String jobId, Throwable cause) {
        log.error("[ALERT {}] dispatch of job {} failed", DISPATCH_FAILED, jobId, cause);
    }
}
