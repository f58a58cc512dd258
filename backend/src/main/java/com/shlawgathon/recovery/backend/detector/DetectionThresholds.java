package com.shlawgathon.recovery.backend.detector;

import java.time.Duration;

/**
 * Tunable limits for failure classification.
 *
 * @param maxSessionDuration            session lifetime before a timeout failure is raised
 * @param apiErrorThreshold             consecutive failed API calls that raise an api-error failure
 * @param fileModificationLoopThreshold consecutive edits of one file without passing tests that raise a loop failure
 */
public record DetectionThresholds(Duration maxSessionDuration,
        int apiErrorThreshold,
        int fileModificationLoopThreshold) {

    public static final Duration DEFAULT_MAX_SESSION_DURATION = Duration.ofHours(2);
    public static final int DEFAULT_API_ERROR_THRESHOLD = 5;
    public static final int DEFAULT_FILE_MODIFICATION_LOOP_THRESHOLD = 20;

    public DetectionThresholds {
        if (maxSessionDuration == null || maxSessionDuration.isNegative() || maxSessionDuration.isZero()) {
            throw new IllegalArgumentException("maxSessionDuration must be positive");
        }
        if (apiErrorThreshold < 1 || fileModificationLoopThreshold < 1) {
            throw new IllegalArgumentException("thresholds must be at least 1");
        }
    }

    public static DetectionThresholds defaults() {
        return new DetectionThresholds(DEFAULT_MAX_SESSION_DURATION,
                DEFAULT_API_ERROR_THRESHOLD,
                DEFAULT_FILE_MODIFICATION_LOOP_THRESHOLD);
    }
}
