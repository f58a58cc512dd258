package com.shlawgathon.recovery.backend.config;

import com.shlawgathon.recovery.backend.detector.DetectionThresholds;
import com.shlawgathon.recovery.backend.model.FailureType;
import com.shlawgathon.recovery.backend.model.RecoveryStrategy;
import com.shlawgathon.recovery.backend.recovery.RecoveryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Turns {@code recovery.*} properties into the value objects the detector and orchestrator consume.
 */
@Configuration
public class RecoveryConfig {

    private static final Logger log = LoggerFactory.getLogger(RecoveryConfig.class);

    static final String STRATEGY_PREFIX = "recovery.policy.strategies.";

    @Value("${recovery.detector.max-session-duration:2h}")
    private Duration maxSessionDuration;

    @Value("${recovery.detector.api-error-threshold:5}")
    private int apiErrorThreshold;

    @Value("${recovery.detector.file-modification-loop-threshold:20}")
    private int fileModificationLoopThreshold;

    @Value("${recovery.policy.max-retries:3}")
    private int maxRetries;

    @Value("${recovery.policy.api-backoff-base:1000ms}")
    private Duration apiBackoffBase;

    @Value("${recovery.policy.context-refresh-after:2}")
    private int contextRefreshAfter;

    @Value("${recovery.executor.pool-size:4}")
    private int executorPoolSize;

    @Bean
    public DetectionThresholds detectionThresholds() {
        return new DetectionThresholds(maxSessionDuration, apiErrorThreshold, fileModificationLoopThreshold);
    }

    @Bean
    public RecoveryPolicy recoveryPolicy(Environment environment) {
        RecoveryPolicy policy = new RecoveryPolicy(maxRetries, apiBackoffBase, contextRefreshAfter,
                strategies(environment));
        log.info("[RECOVERY] Policy: {}", policy);
        return policy;
    }

    @Bean
    public ThreadPoolTaskScheduler sessionDeadlineScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("session-deadline-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor recoveryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(executorPoolSize);
        executor.setMaxPoolSize(executorPoolSize);
        executor.setThreadNamePrefix("recovery-");
        return executor;
    }

    static Map<FailureType, RecoveryStrategy> strategies(Environment environment) {
        Map<FailureType, RecoveryStrategy> strategies = RecoveryPolicy.defaultStrategies();
        for (FailureType type : FailureType.values()) {
            String configured = environment.getProperty(STRATEGY_PREFIX + type.name());
            if (configured != null && !configured.isBlank()) {
                strategies.put(type, RecoveryStrategy.valueOf(configured.trim().toUpperCase(Locale.ROOT)));
            }
        }
        return strategies;
    }
}
