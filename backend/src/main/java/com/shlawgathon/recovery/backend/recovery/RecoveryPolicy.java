package com.shlawgathon.recovery.backend.recovery;

import com.shlawgathon.recovery.backend.model.Failure;
import com.shlawgathon.recovery.backend.model.FailureType;
import com.shlawgathon.recovery.backend.model.RecoveryStrategy;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Decides how a failure is recovered.
 *
 * @param maxRetries          automatic attempts per project before escalating to a human
 * @param apiBackoffBase      first backoff delay for rate-limited API failures, doubled per attempt
 * @param contextRefreshAfter attempts already spent after which every failure gets a context refresh
 * @param strategies          strategy per failure type; missing types fall back to {@link RecoveryStrategy#RETRY}
 */
public record RecoveryPolicy(int maxRetries,
        Duration apiBackoffBase,
        int contextRefreshAfter,
        Map<FailureType, RecoveryStrategy> strategies) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_API_BACKOFF_BASE = Duration.ofSeconds(1);
    public static final int DEFAULT_CONTEXT_REFRESH_AFTER = 2;

    private static final int MAX_BACKOFF_DOUBLINGS = 10;

    public RecoveryPolicy {
        if (maxRetries < 0 || contextRefreshAfter < 0) {
            throw new IllegalArgumentException("maxRetries and contextRefreshAfter must not be negative");
        }
        if (apiBackoffBase == null || apiBackoffBase.isNegative()) {
            throw new IllegalArgumentException("apiBackoffBase must not be negative");
        }
        strategies = strategies == null || strategies.isEmpty()
                ? Map.of()
                : Map.copyOf(strategies);
        strategies.values().forEach(strategy -> {
            if (!strategy.relaunches()) {
                throw new IllegalArgumentException("Not an automatic strategy: " + strategy);
            }
        });
    }

    public static RecoveryPolicy defaults() {
        return new RecoveryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_API_BACKOFF_BASE,
                DEFAULT_CONTEXT_REFRESH_AFTER, defaultStrategies());
    }

    public static Map<FailureType, RecoveryStrategy> defaultStrategies() {
        Map<FailureType, RecoveryStrategy> defaults = new EnumMap<>(FailureType.class);
        defaults.put(FailureType.CRASH, RecoveryStrategy.RETRY);
        defaults.put(FailureType.API_ERROR, RecoveryStrategy.RETRY);
        defaults.put(FailureType.STUCK, RecoveryStrategy.CHECKPOINT_RECOVERY);
        defaults.put(FailureType.LOOP, RecoveryStrategy.CHECKPOINT_RECOVERY);
        defaults.put(FailureType.TIMEOUT, RecoveryStrategy.CHECKPOINT_RECOVERY);
        return defaults;
    }

    /**
     * Strategy for the next attempt on a project that has already spent {@code attemptsSpent} attempts.
     */
    public RecoveryStrategy strategyFor(Failure failure, int attemptsSpent) {
        if (attemptsSpent >= contextRefreshAfter) {
            return RecoveryStrategy.CONTEXT_REFRESH;
        }
        return strategies.getOrDefault(failure.getFailureType(), RecoveryStrategy.RETRY);
    }

    /**
     * Delay before relaunching; zero unless the failure is rate limited.
     *
     * @param attempt 1-based attempt number
     */
    public Duration backoffFor(Failure failure, int attempt) {
        if (!isRateLimited(failure) || attempt < 1) {
            return Duration.ZERO;
        }
        int doublings = Math.min(attempt - 1, MAX_BACKOFF_DOUBLINGS);
        return apiBackoffBase.multipliedBy(1L << doublings);
    }

    public boolean isRateLimited(Failure failure) {
        if (failure.getFailureType() != FailureType.API_ERROR) {
            return false;
        }
        Object statusCode = failure.getMetadata() != null ? failure.getMetadata().get("statusCode") : null;
        if (statusCode instanceof Number number && number.intValue() == 429) {
            return true;
        }
        String details = failure.getErrorDetails();
        return details != null && details.toLowerCase(Locale.ROOT).contains("rate limit");
    }
}
