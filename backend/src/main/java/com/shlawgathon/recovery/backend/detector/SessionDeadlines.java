package com.shlawgathon.recovery.backend.detector;

import java.time.Duration;

/**
 * Schedules one-shot deadline callbacks for tracked sessions.
 */
public interface SessionDeadlines {

    /**
     * Run {@code onDeadline} once after {@code delay} unless the returned handle is cancelled first.
     */
    Cancellable schedule(Duration delay, Runnable onDeadline);

    interface Cancellable {
        void cancel();
    }
}
