package com.shlawgathon.recovery.backend.detector;

/**
 * Counts consecutive failures and trips once every {@code threshold} of them.
 * A success clears the count. Not thread-safe; callers hold the owning session's lock.
 */
public final class ConsecutiveCounter {

    private final int threshold;
    private int count;

    public ConsecutiveCounter(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be at least 1");
        }
        this.threshold = threshold;
    }

    /**
     * Record a failure.
     *
     * @return true on the failure that reaches the threshold; the count is cleared before returning
     */
    public boolean onFailure() {
        count++;
        if (count >= threshold) {
            count = 0;
            return true;
        }
        return false;
    }

    public void onSuccess() {
        count = 0;
    }

    public int count() {
        return count;
    }
}
