package com.starscape.bracketflow.features.grouping.app;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion per job id. Serializes long-running work (EXIF reads and
 * grouping) that cannot hold a database row lock for its whole duration.
 */
@Component
public class JobLocks {
    
    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();
    
    public <T> T withLock(String jobId, Supplier<T> work) {
        Entry entry = locks.compute(jobId, (id, current) -> {
            Entry next = current != null ? current : new Entry();
            next.users++;
            return next;
        });
        entry.lock.lock();
        try {
            return work.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(jobId, (id, current) -> --current.users == 0 ? null : current);
        }
    }
    
    int activeKeys() {
        return locks.size();
    }
    
    // users is only touched inside compute/computeIfPresent for its key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
