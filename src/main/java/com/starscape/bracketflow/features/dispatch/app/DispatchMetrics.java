package com.starscape.bracketflow.features.dispatch.app;

import com.starscape.bracketflow.common.config.DispatchProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process dispatch gauges: runs waiting for a slot or running at the provider, and
 * the rolling average run duration used for ETA estimates.
 */
@Component
public class DispatchMetrics {
    
    private final DispatchProperties properties;
    private final AtomicInteger waiting = new AtomicInteger();
    private final ConcurrentMap<String, Instant> running = new ConcurrentHashMap<>();
    private final AtomicLong started = new AtomicLong();
    private final AtomicLong finished = new AtomicLong();
    private final AtomicLong cumulativeSeconds = new AtomicLong();
    
    public DispatchMetrics(DispatchProperties properties) {
        this.properties = properties;
    }
    
    public void beginWaiting() {
        waiting.incrementAndGet();
    }
    
    public void abortWaiting() {
        waiting.decrementAndGet();
    }
    
    public void recordStart(String jobId) {
        waiting.decrementAndGet();
        started.incrementAndGet();
        running.put(jobId, Instant.now());
    }
    
    /**
     * Counts a finished run towards the average. Unknown jobs (started before a restart,
     * or already counted) are ignored.
     */
    public void recordFinish(String jobId) {
        Instant start = running.remove(jobId);
        if (start == null) {
            return;
        }
        finished.incrementAndGet();
        cumulativeSeconds.addAndGet(Math.max(0, Duration.between(start, Instant.now()).toSeconds()));
    }
    
    /**
     * Stops tracking a run without counting its duration (canceled jobs).
     */
    public void forget(String jobId) {
        running.remove(jobId);
    }
    
    public int pending() {
        return Math.max(0, waiting.get()) + running.size();
    }
    
    public long startedCount() {
        return started.get();
    }
    
    public long finishedCount() {
        return finished.get();
    }
    
    public long averageRunSeconds() {
        long count = finished.get();
        if (count == 0) {
            return properties.getEstimatedRunSeconds();
        }
        return Math.max(properties.getMinEstimatedRunSeconds(), cumulativeSeconds.get() / count);
    }
    
    /**
     * {@code ceil(pending / concurrency * averageRunSeconds)}.
     */
    public long etaSeconds(int pending) {
        int concurrency = Math.max(1, properties.getMaxConcurrency());
        return (long) Math.ceil((double) pending / concurrency * averageRunSeconds());
    }
}
