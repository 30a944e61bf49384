package com.starscape.bracketflow.support;

import com.starscape.bracketflow.features.trackprogress.domain.EventSink;
import com.starscape.bracketflow.features.trackprogress.domain.JobEvent;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures what a subscriber would have received. Can be told to fail like a dropped client.
 */
public class RecordingEventSink implements EventSink {

    private final List<JobEvent> sent = new ArrayList<>();
    private final List<Runnable> disconnectCallbacks = new ArrayList<>();
    private int heartbeats;
    private int completions;
    private boolean broken;

    @Override
    public synchronized void send(JobEvent event) throws IOException {
        if (broken) {
            throw new IOException("Broken pipe");
        }
        sent.add(event);
    }

    @Override
    public synchronized void heartbeat() throws IOException {
        if (broken) {
            throw new IOException("Broken pipe");
        }
        heartbeats++;
    }

    @Override
    public synchronized void complete() {
        completions++;
    }

    @Override
    public synchronized void onDisconnect(Runnable callback) {
        disconnectCallbacks.add(callback);
    }

    public void disconnect() {
        List<Runnable> callbacks;
        synchronized (this) {
            callbacks = new ArrayList<>(disconnectCallbacks);
        }
        callbacks.forEach(Runnable::run);
    }

    public synchronized void breakConnection() {
        this.broken = true;
    }

    public synchronized List<Long> sequences() {
        return sent.stream().map(JobEvent::getSequence).toList();
    }

    public synchronized List<JobEvent> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized int heartbeats() {
        return heartbeats;
    }

    public synchronized int completions() {
        return completions;
    }
}
