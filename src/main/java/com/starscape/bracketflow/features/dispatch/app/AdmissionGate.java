package com.starscape.bracketflow.features.dispatch.app;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide limit on concurrent calls to the compute provider. Waiting callers are
 * admitted first-in, first-out. One instance is shared by every job.
 */
public class AdmissionGate {
    
    private final int capacity;
    private final Semaphore permits;
    
    public AdmissionGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Admission capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }
    
    /**
     * Blocks until a slot is free. Close the returned permit to give the slot back.
     */
    public Permit acquire() {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a compute slot", e);
        }
        return new Permit();
    }
    
    public int capacity() {
        return capacity;
    }
    
    public int inFlight() {
        return capacity - permits.availablePermits();
    }
    
    public int waiting() {
        return permits.getQueueLength();
    }
    
    /**
     * One admitted call. Closing twice releases once.
     */
    public final class Permit implements AutoCloseable {
        
        private final AtomicBoolean released = new AtomicBoolean();
        
        private Permit() {
        }
        
        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }
}
