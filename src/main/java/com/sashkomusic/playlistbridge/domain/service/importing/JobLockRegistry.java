package com.sashkomusic.playlistbridge.domain.service.importing;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes writes to a single job record and carries cooperative cancellation flags.
 */
@Component
public class JobLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

    public <T> T withLock(String jobId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(jobId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(String jobId, Runnable action) {
        withLock(jobId, () -> {
            action.run();
            return null;
        });
    }

    public void requestCancel(String jobId) {
        cancelled.add(jobId);
    }

    public boolean isCancelled(String jobId) {
        return cancelled.contains(jobId);
    }

    /**
     * Forgets the job. A lock that another thread holds or waits for is kept.
     */
    public void release(String jobId) {
        cancelled.remove(jobId);
        locks.computeIfPresent(jobId, (id, lock) -> inUseElsewhere(lock) ? lock : null);
    }

    public boolean isTracked(String jobId) {
        return locks.containsKey(jobId) || cancelled.contains(jobId);
    }

    private static boolean inUseElsewhere(ReentrantLock lock) {
        return lock.hasQueuedThreads() || (lock.isLocked() && !lock.isHeldByCurrentThread());
    }
}
