package com.shlawgathon.recovery.backend.recovery;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Automatic recovery attempts spent per project.
 */
class RetryLedger {

    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

    /**
     * Reserve the next attempt.
     *
     * @return the 1-based attempt number, or 0 when {@code maxRetries} attempts are already spent
     */
    int tryAcquire(String projectId, int maxRetries) {
        AtomicInteger counter = attempts.computeIfAbsent(projectId, k -> new AtomicInteger());
        while (true) {
            int spent = counter.get();
            if (spent >= maxRetries) {
                return 0;
            }
            if (counter.compareAndSet(spent, spent + 1)) {
                return spent + 1;
            }
        }
    }

    int spent(String projectId) {
        AtomicInteger counter = attempts.get(projectId);
        return counter != null ? counter.get() : 0;
    }

    void reset(String projectId) {
        attempts.remove(projectId);
    }
}
