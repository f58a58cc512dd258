package com.shlawgathon.recovery.backend.detector;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Deadlines that only fire when the test says so.
 */
public class ManualDeadlines implements SessionDeadlines {

    private final List<Pending> pending = new ArrayList<>();

    @Override
    public synchronized Cancellable schedule(Duration delay, Runnable onDeadline) {
        Pending deadline = new Pending(delay, onDeadline);
        pending.add(deadline);
        return () -> deadline.cancelled = true;
    }

    /**
     * Fire every deadline scheduled so far, cancelled or not, the way a timer racing a cancel would.
     */
    public void fireAll() {
        List<Pending> due;
        synchronized (this) {
            due = new ArrayList<>(pending);
            pending.clear();
        }
        due.forEach(deadline -> deadline.onDeadline.run());
    }

    /**
     * Fire only deadlines that were not cancelled.
     */
    public void fireActive() {
        List<Pending> due;
        synchronized (this) {
            due = pending.stream().filter(deadline -> !deadline.cancelled).toList();
            pending.clear();
        }
        due.forEach(deadline -> deadline.onDeadline.run());
    }

    public synchronized int activeCount() {
        return (int) pending.stream().filter(deadline -> !deadline.cancelled).count();
    }

    public synchronized Duration lastDelay() {
        return pending.isEmpty() ? null : pending.get(pending.size() - 1).delay;
    }

    private static final class Pending {
        private final Duration delay;
        private final Runnable onDeadline;
        private volatile boolean cancelled;

        private Pending(Duration delay, Runnable onDeadline) {
            this.delay = delay;
            this.onDeadline = onDeadline;
        }
    }
}
