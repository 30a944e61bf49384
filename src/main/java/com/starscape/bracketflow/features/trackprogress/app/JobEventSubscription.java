package com.starscape.bracketflow.features.trackprogress.app;

import com.starscape.bracketflow.features.jobs.domain.events.JobFinished;
import com.starscape.bracketflow.features.trackprogress.domain.EventSink;
import com.starscape.bracketflow.features.trackprogress.domain.JobEvent;
import com.starscape.bracketflow.features.trackprogress.domain.JobEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One live connection for one job.
 * <p>
 * Delivers each sequence at most once and in order. Live events that arrive while the
 * persisted backlog is replaying are buffered; a live event that skips ahead triggers a
 * backfill from the log so the client never sees a gap.
 */
public class JobEventSubscription {
    
    private static final Logger log = LoggerFactory.getLogger(JobEventSubscription.class);
    
    private final String jobId;
    private final EventSink sink;
    private final JobEventRepository eventRepository;
    private final List<JobEvent> buffered = new ArrayList<>();
    private final List<Runnable> closeHooks = new ArrayList<>();
    
    private long lastDelivered;
    private boolean replaying = true;
    private boolean closed;
    
    public JobEventSubscription(String jobId, EventSink sink, JobEventRepository eventRepository) {
        this.jobId = jobId;
        this.sink = sink;
        this.eventRepository = eventRepository;
        sink.onDisconnect(this::close);
    }
    
    public String getJobId() {
        return jobId;
    }
    
    public synchronized long getLastDelivered() {
        return lastDelivered;
    }
    
    public synchronized boolean isClosed() {
        return closed;
    }
    
    synchronized void onClose(Runnable hook) {
        closeHooks.add(hook);
    }
    
    /**
     * Sends everything persisted after {@code afterSequence}, then switches to live delivery.
     */
    public synchronized void start(long afterSequence) {
        lastDelivered = afterSequence;
        for (JobEvent event : eventRepository.findByJobIdAndSequenceGreaterThanOrderBySequenceAsc(jobId, afterSequence)) {
            if (closed) {
                return;
            }
            deliver(event);
        }
        replaying = false;
        buffered.sort(Comparator.comparingLong(JobEvent::getSequence));
        List<JobEvent> pending = new ArrayList<>(buffered);
        buffered.clear();
        for (JobEvent event : pending) {
            if (closed) {
                return;
            }
            deliverLive(event);
        }
    }
    
    public synchronized void offer(JobEvent event) {
        if (closed) {
            return;
        }
        if (replaying) {
            buffered.add(event);
            return;
        }
        deliverLive(event);
    }
    
    public synchronized void heartbeat() {
        if (closed) {
            return;
        }
        try {
            sink.heartbeat();
        } catch (IOException e) {
            log.debug("Heartbeat failed for job {}, closing stream: {}", jobId, e.getMessage());
            close();
        }
    }
    
    public void close() {
        List<Runnable> hooks;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            buffered.clear();
            hooks = new ArrayList<>(closeHooks);
        }
        sink.complete();
        hooks.forEach(Runnable::run);
    }
    
    private void deliverLive(JobEvent event) {
        if (event.getSequence() <= lastDelivered) {
            return;
        }
        if (event.getSequence() > lastDelivered + 1) {
            for (JobEvent missed : eventRepository.findByJobIdAndSequenceGreaterThanOrderBySequenceAsc(jobId, lastDelivered)) {
                if (missed.getSequence() >= event.getSequence() || closed) {
                    break;
                }
                deliver(missed);
            }
        }
        if (!closed) {
            deliver(event);
        }
    }
    
    private void deliver(JobEvent event) {
        if (event.getSequence() <= lastDelivered) {
            return;
        }
        try {
            sink.send(event);
            lastDelivered = event.getSequence();
        } catch (IOException e) {
            log.debug("Client of job {} went away at sequence {}: {}", jobId, event.getSequence(), e.getMessage());
            close();
            return;
        }
        if (JobFinished.TYPE.equals(event.getEventType())) {
            close();
        }
    }
}
