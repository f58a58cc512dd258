package com.shlawgathon.recovery.backend.recovery;

import com.shlawgathon.recovery.backend.detector.FailureDetector;
import com.shlawgathon.recovery.backend.dto.LaunchRequest;
import com.shlawgathon.recovery.backend.dto.ResumeCheckpoint;
import com.shlawgathon.recovery.backend.dto.SessionRegistration;
import com.shlawgathon.recovery.backend.events.AgentChannels;
import com.shlawgathon.recovery.backend.events.AgentEventBus;
import com.shlawgathon.recovery.backend.events.RecoveryAttemptEvent;
import com.shlawgathon.recovery.backend.events.RecoveryEscalationEvent;
import com.shlawgathon.recovery.backend.events.RecoverySuccessEvent;
import com.shlawgathon.recovery.backend.model.Checkpoint;
import com.shlawgathon.recovery.backend.model.Failure;
import com.shlawgathon.recovery.backend.model.FailureType;
import com.shlawgathon.recovery.backend.model.ManualOverrideAction;
import com.shlawgathon.recovery.backend.model.ManualOverrideParams;
import com.shlawgathon.recovery.backend.model.PipelineRecoveryStatus;
import com.shlawgathon.recovery.backend.model.RecoveryAction;
import com.shlawgathon.recovery.backend.model.RecoveryHistoryEntry;
import com.shlawgathon.recovery.backend.model.RecoveryResult;
import com.shlawgathon.recovery.backend.model.RecoveryStrategy;
import com.shlawgathon.recovery.backend.service.CheckpointService;
import com.shlawgathon.recovery.backend.service.RecoveryHistoryService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Reacts to {@code agent:failure} events and drives the failed story back to a running session.
 * <p>
 * Automatic attempts are budgeted per project. Once the budget is spent the failure is
 * escalated and stays open until a human applies a {@link ManualOverrideAction}.
 */
@Service
public class RecoveryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryOrchestrator.class);

    static final int STATUS_HISTORY_LIMIT = 50;
    static final Duration RETIRED_SESSION_MEMORY = Duration.ofHours(1);

    static final String ESCALATED_MESSAGE = "Recovery retries exhausted, escalated to user";
    static final String UNKNOWN_OWNER_MESSAGE = "Failure owner unknown, escalated to user";

    private static final List<ManualOverrideAction> OVERRIDE_OPTIONS = List.of(
            ManualOverrideAction.TERMINATE,
            ManualOverrideAction.REASSIGN,
            ManualOverrideAction.PROVIDE_GUIDANCE);

    private final FailureDetector detector;
    private final CheckpointService checkpointService;
    private final SessionLauncher sessionLauncher;
    private final AgentEventBus eventBus;
    private final RecoveryHistoryService historyService;
    private final RecoveryPolicy policy;
    private final Executor executor;

    private final RetryLedger retries = new RetryLedger();
    // sessionId -> when the orchestrator retired it
    private final Map<String, Instant> retiredSessions = new ConcurrentHashMap<>();
    // failureId -> which path is currently handling it
    private final Map<String, Claim> inFlight = new ConcurrentHashMap<>();

    private AgentEventBus.Subscription subscription;

    public RecoveryOrchestrator(FailureDetector detector,
            CheckpointService checkpointService,
            SessionLauncher sessionLauncher,
            AgentEventBus eventBus,
            RecoveryHistoryService historyService,
            RecoveryPolicy policy,
            @Qualifier("recoveryExecutor") Executor executor) {
        this.detector = detector;
        this.checkpointService = checkpointService;
        this.sessionLauncher = sessionLauncher;
        this.eventBus = eventBus;
        this.historyService = historyService;
        this.policy = policy;
        this.executor = executor;
    }

    @PostConstruct
    public void start() {
        subscription = eventBus.subscribe(AgentChannels.FAILURE, Failure.class, this::onFailure);
        log.info("[RECOVERY] Listening on {} | Max retries: {} | Context refresh after: {}",
                AgentChannels.FAILURE, policy.maxRetries(), policy.contextRefreshAfter());
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
    }

    /**
     * Recover a failure: relaunch within budget, otherwise escalate.
     * The returned future never completes exceptionally.
     */
    public CompletableFuture<RecoveryResult> handleFailure(Failure failure) {
        if (inFlight.putIfAbsent(failure.getId(), Claim.AUTOMATIC) != null) {
            log.debug("[RECOVERY] Failure {} is already being handled", failure.getId());
            return CompletableFuture.completedFuture(skipped(failure, "Recovery already in progress"));
        }

        CompletableFuture<RecoveryResult> result;
        try {
            result = recover(failure);
        } catch (RuntimeException e) {
            log.error("[RECOVERY] Unexpected error handling failure: {}", failure.getId(), e);
            result = CompletableFuture.completedFuture(skipped(failure, e.getMessage()));
        }
        return result.whenComplete((r, e) -> inFlight.remove(failure.getId(), Claim.AUTOMATIC));
    }

    /**
     * Apply a human decision to an open failure.
     *
     * @throws FailureNotFoundException if the failure is not active
     * @throws RecoveryInProgressException if a relaunch of the failure has not completed yet
     * @throws IllegalArgumentException if the override is missing data its action needs
     */
    public CompletableFuture<RecoveryResult> handleManualOverride(ManualOverrideParams override) {
        if (override.getAction() == null) {
            throw new IllegalArgumentException("Override action is required");
        }
        Failure failure = detector.getFailure(override.getFailureId())
                .orElseThrow(() -> new FailureNotFoundException(override.getFailureId()));

        if (inFlight.putIfAbsent(failure.getId(), Claim.MANUAL) != null) {
            throw new RecoveryInProgressException(failure.getId());
        }

        log.info("[RECOVERY] Manual override {} on failure: {} by user: {}",
                override.getAction(), failure.getId(), override.getUserId());

        CompletableFuture<RecoveryResult> result;
        try {
            result = switch (override.getAction()) {
                case TERMINATE -> CompletableFuture.completedFuture(terminate(failure, override));
                case REASSIGN -> {
                    requireText(override.getReassignToAgentType(), "reassignToAgentType is required for REASSIGN");
                    yield relaunchManually(failure, override, override.getReassignToAgentType());
                }
                case PROVIDE_GUIDANCE -> {
                    requireText(failure.getAgentType(), "Failure " + failure.getId()
                            + " has no agent type, use REASSIGN with reassignToAgentType");
                    requireText(override.getGuidance(), "guidance is required for PROVIDE_GUIDANCE");
                    yield relaunchManually(failure, override, failure.getAgentType());
                }
            };
        } catch (RuntimeException e) {
            inFlight.remove(failure.getId(), Claim.MANUAL);
            throw e;
        }
        return result.whenComplete((r, e) -> inFlight.remove(failure.getId(), Claim.MANUAL));
    }

    /**
     * Current recovery state of a project's pipeline.
     */
    public PipelineRecoveryStatus getRecoveryStatus(String projectId) {
        List<Failure> active = detector.getActiveFailures().stream()
                .filter(failure -> projectId.equals(failure.getProjectId()))
                .toList();

        List<RecoveryHistoryEntry> history;
        try {
            history = historyService.recentForProject(projectId, STATUS_HISTORY_LIMIT);
        } catch (RuntimeException e) {
            log.error("[RECOVERY] History lookup failed for project: {}", projectId, e);
            history = List.of();
        }

        return PipelineRecoveryStatus.builder()
                .projectId(projectId)
                .activeFailures(active)
                .recoveryHistory(history)
                .escalated(active.stream().anyMatch(f -> f.getRecoveryAction() == RecoveryAction.ESCALATED))
                .totalRetries(retries.spent(projectId))
                .maxRetries(policy.maxRetries())
                .build();
    }

    private void onFailure(Failure failure) {
        CompletableFuture.runAsync(() -> handleFailure(failure)
                .thenAccept(result -> log.debug("[RECOVERY] Failure {} handled: success={} strategy={}",
                        failure.getId(), result.isSuccess(), result.getStrategy())), executor);
    }

    private CompletableFuture<RecoveryResult> recover(Failure failure) {
        long startedAt = System.currentTimeMillis();

        if (detector.getFailure(failure.getId()).isEmpty()) {
            return CompletableFuture.completedFuture(skipped(failure, "Failure already resolved"));
        }
        if (isStale(failure)) {
            log.info("[RECOVERY] Discarding {} failure {} for inactive session: {}",
                    failure.getFailureType(), failure.getId(), failure.getSessionId());
            detector.resolveFailure(failure.getId());
            return CompletableFuture.completedFuture(skipped(failure, "Session no longer active"));
        }

        // A crashed process raises no further signals; stop its deadline
        if (failure.getFailureType() == FailureType.CRASH && !isRecoveryFailure(failure)) {
            detector.unregisterSession(failure.getSessionId());
        }

        if (!hasKnownOwner(failure)) {
            return CompletableFuture.completedFuture(escalate(failure, UNKNOWN_OWNER_MESSAGE, startedAt));
        }

        int attempt = retries.tryAcquire(failure.getProjectId(), policy.maxRetries());
        if (attempt == 0) {
            return CompletableFuture.completedFuture(escalate(failure, ESCALATED_MESSAGE, startedAt));
        }

        RecoveryStrategy strategy = policy.strategyFor(failure, attempt - 1);
        detector.recordRecoveryAction(failure.getId(), strategy.toAction());

        Checkpoint checkpoint = resumePointFor(failure, strategy);
        String checkpointUsed = checkpoint != null ? checkpoint.getCommitHash() : null;

        log.info("[RECOVERY] Attempt {}/{} for failure: {} | Type: {} | Strategy: {} | Checkpoint: {}",
                attempt, policy.maxRetries(), failure.getId(), failure.getFailureType(), strategy,
                checkpointUsed != null ? checkpointUsed : "none");

        eventBus.publish(AgentChannels.RECOVERY_ATTEMPT, RecoveryAttemptEvent.builder()
                .workspaceId(failure.getWorkspaceId())
                .projectId(failure.getProjectId())
                .storyId(failure.getStoryId())
                .agentId(failure.getAgentId())
                .failureId(failure.getId())
                .strategy(strategy)
                .retryCount(attempt)
                .checkpointUsed(checkpointUsed)
                .timestamp(Instant.now())
                .build());

        LaunchRequest launch = LaunchRequest.builder()
                .agentType(failure.getAgentType())
                .agentId(failure.getAgentId())
                .projectId(failure.getProjectId())
                .workspaceId(failure.getWorkspaceId())
                .storyId(failure.getStoryId())
                .resumeFrom(ResumeCheckpoint.from(checkpoint))
                .refreshContext(strategy == RecoveryStrategy.CONTEXT_REFRESH)
                .build();

        Duration backoff = policy.backoffFor(failure, attempt);
        if (!backoff.isZero()) {
            log.info("[RECOVERY] Rate limited, backing off {} ms before attempt {}", backoff.toMillis(), attempt);
        }

        return launchAfter(backoff, launch).handle((newSessionId, error) -> {
            if (error != null) {
                return onRelaunchFailed(failure, strategy, attempt, checkpointUsed, unwrap(error), startedAt);
            }
            return onRelaunched(failure, strategy, attempt, checkpointUsed, newSessionId, startedAt);
        });
    }

    private CompletableFuture<String> launchAfter(Duration delay, LaunchRequest launch) {
        Executor launchExecutor = delay.isZero()
                ? executor
                : CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
        return CompletableFuture.supplyAsync(() -> launch, launchExecutor)
                .thenCompose(sessionLauncher::launchSession);
    }

    private RecoveryResult onRelaunched(Failure failure, RecoveryStrategy strategy, int attempt,
            String checkpointUsed, String newSessionId, long startedAt) {
        if (detector.getFailure(failure.getId()).isEmpty()) {
            log.warn("[RECOVERY] Failure {} was resolved while relaunching, stopping new session: {}",
                    failure.getId(), newSessionId);
            retireSession(newSessionId);
            return RecoveryResult.builder()
                    .success(false)
                    .strategy(strategy)
                    .failureId(failure.getId())
                    .retryCount(attempt)
                    .checkpointUsed(checkpointUsed)
                    .error("Failure resolved while relaunching")
                    .build();
        }

        log.info("[RECOVERY] Failure {} recovered with {} | New session: {}", failure.getId(), strategy, newSessionId);

        detector.registerSession(replacementOf(failure, newSessionId, failure.getAgentType()));
        retireSession(failure.getSessionId());
        detector.resolveFailure(failure.getId());
        historyService.record(failure, strategy, attempt, true, checkpointUsed, null, startedAt);

        eventBus.publish(AgentChannels.RECOVERY_SUCCESS, successEvent(failure, strategy, attempt,
                checkpointUsed, newSessionId, failure.getAgentType()));

        return RecoveryResult.builder()
                .success(true)
                .strategy(strategy)
                .failureId(failure.getId())
                .retryCount(attempt)
                .newSessionId(newSessionId)
                .checkpointUsed(checkpointUsed)
                .build();
    }

    private RecoveryResult onRelaunchFailed(Failure failure, RecoveryStrategy strategy, int attempt,
            String checkpointUsed, Throwable cause, long startedAt) {
        log.error("[RECOVERY] Attempt {} for failure {} failed: {}", attempt, failure.getId(), cause.getMessage());

        historyService.record(failure, strategy, attempt, false, checkpointUsed, cause.getMessage(), startedAt);
        detector.resolveFailure(failure.getId());
        detector.reportRecoveryFailure(failure, cause);

        return RecoveryResult.builder()
                .success(false)
                .strategy(strategy)
                .failureId(failure.getId())
                .retryCount(attempt)
                .checkpointUsed(checkpointUsed)
                .error(cause.getMessage())
                .build();
    }

    private RecoveryResult escalate(Failure failure, String reason, long startedAt) {
        int spent = hasKnownOwner(failure) ? retries.spent(failure.getProjectId()) : 0;
        log.warn("[RECOVERY] Escalating failure: {} | Project: {} | Retries: {} | {}",
                failure.getId(), failure.getProjectId(), spent, reason);

        // Automatic handling ends here; an override may follow as soon as ESCALATED is visible
        inFlight.remove(failure.getId(), Claim.AUTOMATIC);

        detector.recordRecoveryAction(failure.getId(), RecoveryAction.ESCALATED);
        historyService.record(failure, RecoveryStrategy.ESCALATION, spent, false,
                failure.getLastCheckpoint(), reason, startedAt);

        eventBus.publish(AgentChannels.RECOVERY_ESCALATION, RecoveryEscalationEvent.builder()
                .workspaceId(failure.getWorkspaceId())
                .projectId(failure.getProjectId())
                .storyId(failure.getStoryId())
                .agentId(failure.getAgentId())
                .failureId(failure.getId())
                .totalRetries(spent)
                .lastFailureType(failure.getFailureType())
                .lastErrorDetails(failure.getErrorDetails())
                .overrideOptions(OVERRIDE_OPTIONS)
                .timestamp(Instant.now())
                .build());

        return RecoveryResult.builder()
                .success(false)
                .strategy(RecoveryStrategy.ESCALATION)
                .failureId(failure.getId())
                .retryCount(spent)
                .checkpointUsed(failure.getLastCheckpoint())
                .error(reason)
                .build();
    }

    private RecoveryResult terminate(Failure failure, ManualOverrideParams override) {
        long startedAt = System.currentTimeMillis();
        detector.recordRecoveryAction(failure.getId(), RecoveryAction.MANUAL_OVERRIDE);
        retireSession(failure.getSessionId());
        detector.resolveFailure(failure.getId());
        historyService.recordOverride(failure, override, true, null, null, startedAt);

        // Only a relaunching override restores the project budget
        return RecoveryResult.builder()
                .success(true)
                .strategy(RecoveryStrategy.MANUAL_OVERRIDE)
                .failureId(failure.getId())
                .retryCount(hasKnownOwner(failure) ? retries.spent(failure.getProjectId()) : 0)
                .build();
    }

    private CompletableFuture<RecoveryResult> relaunchManually(Failure failure, ManualOverrideParams override,
            String agentType) {
        if (!hasKnownOwner(failure)) {
            throw new IllegalArgumentException("Failure " + failure.getId()
                    + " has no known owner, only TERMINATE applies");
        }
        long startedAt = System.currentTimeMillis();
        detector.recordRecoveryAction(failure.getId(), RecoveryAction.MANUAL_OVERRIDE);

        Checkpoint checkpoint = storyCheckpoint(failure).or(() -> sessionCheckpoint(failure)).orElse(null);
        String checkpointUsed = checkpoint != null ? checkpoint.getCommitHash() : null;

        LaunchRequest launch = LaunchRequest.builder()
                .agentType(agentType)
                .agentId(Objects.equals(agentType, failure.getAgentType()) ? failure.getAgentId() : null)
                .projectId(failure.getProjectId())
                .workspaceId(failure.getWorkspaceId())
                .storyId(failure.getStoryId())
                .resumeFrom(ResumeCheckpoint.from(checkpoint))
                .guidance(override.getGuidance())
                .build();

        return launchAfter(Duration.ZERO, launch).handle((newSessionId, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                log.error("[RECOVERY] Manual {} of failure {} failed: {}",
                        override.getAction(), failure.getId(), cause.getMessage());
                historyService.recordOverride(failure, override, false, checkpointUsed, cause.getMessage(), startedAt);
                return RecoveryResult.builder()
                        .success(false)
                        .strategy(RecoveryStrategy.MANUAL_OVERRIDE)
                        .failureId(failure.getId())
                        .retryCount(failure.getRetryCount())
                        .checkpointUsed(checkpointUsed)
                        .error(cause.getMessage())
                        .build();
            }

            SessionRegistration registration = replacementOf(failure, newSessionId, agentType);
            registration.setAgentId(launch.getAgentId());
            detector.registerSession(registration);
            retireSession(failure.getSessionId());
            detector.resolveFailure(failure.getId());
            retries.reset(failure.getProjectId());
            historyService.recordOverride(failure, override, true, checkpointUsed, null, startedAt);

            eventBus.publish(AgentChannels.RECOVERY_SUCCESS, successEvent(failure, RecoveryStrategy.MANUAL_OVERRIDE,
                    failure.getRetryCount(), checkpointUsed, newSessionId, agentType));

            log.info("[RECOVERY] Manual {} of failure {} started session: {} ({})",
                    override.getAction(), failure.getId(), newSessionId, agentType);
            return RecoveryResult.builder()
                    .success(true)
                    .strategy(RecoveryStrategy.MANUAL_OVERRIDE)
                    .failureId(failure.getId())
                    .retryCount(failure.getRetryCount())
                    .newSessionId(newSessionId)
                    .checkpointUsed(checkpointUsed)
                    .build();
        });
    }

    private boolean isStale(Failure failure) {
        if (isRecoveryFailure(failure)) {
            return false;
        }
        if (retiredSessions.containsKey(failure.getSessionId())) {
            return true;
        }
        return failure.getFailureType() == FailureType.TIMEOUT && !detector.isTracking(failure.getSessionId());
    }

    private static boolean isRecoveryFailure(Failure failure) {
        return failure.getMetadata() != null && failure.getMetadata().containsKey(FailureDetector.RECOVERY_OF);
    }

    private static boolean hasKnownOwner(Failure failure) {
        return isKnown(failure.getProjectId()) && isKnown(failure.getStoryId());
    }

    private static boolean isKnown(String id) {
        return id != null && !id.isBlank() && !FailureDetector.UNKNOWN.equals(id);
    }

    private Checkpoint resumePointFor(Failure failure, RecoveryStrategy strategy) {
        Optional<Checkpoint> checkpoint = strategy == RecoveryStrategy.RETRY
                ? sessionCheckpoint(failure).or(() -> storyCheckpoint(failure))
                : storyCheckpoint(failure).or(() -> sessionCheckpoint(failure));
        return checkpoint.orElse(null);
    }

    private Optional<Checkpoint> sessionCheckpoint(Failure failure) {
        try {
            return checkpointService.getLatestCheckpoint(failure.getSessionId());
        } catch (RuntimeException e) {
            log.error("[RECOVERY] Session checkpoint lookup failed for: {}", failure.getSessionId(), e);
            return Optional.empty();
        }
    }

    private Optional<Checkpoint> storyCheckpoint(Failure failure) {
        if (!isKnown(failure.getWorkspaceId()) || !isKnown(failure.getStoryId())) {
            return Optional.empty();
        }
        try {
            return checkpointService.getLatestStoryCheckpoint(failure.getWorkspaceId(), failure.getStoryId());
        } catch (RuntimeException e) {
            log.error("[RECOVERY] Story checkpoint lookup failed for: {}/{}",
                    failure.getWorkspaceId(), failure.getStoryId(), e);
            return Optional.empty();
        }
    }

    private void retireSession(String sessionId) {
        Instant now = Instant.now();
        retiredSessions.values().removeIf(retiredAt -> retiredAt.isBefore(now.minus(RETIRED_SESSION_MEMORY)));
        retiredSessions.put(sessionId, now);

        detector.unregisterSession(sessionId);
        try {
            sessionLauncher.terminateSession(sessionId).exceptionally(e -> {
                log.warn("[RECOVERY] Could not terminate session: {} - {}", sessionId, unwrap(e).getMessage());
                return null;
            });
        } catch (RuntimeException e) {
            log.warn("[RECOVERY] Could not terminate session: {} - {}", sessionId, e.getMessage());
        }
    }

    private static SessionRegistration replacementOf(Failure failure, String newSessionId, String agentType) {
        return SessionRegistration.builder()
                .sessionId(newSessionId)
                .agentId(failure.getAgentId())
                .agentType(agentType)
                .projectId(failure.getProjectId())
                .workspaceId(failure.getWorkspaceId())
                .storyId(failure.getStoryId())
                .build();
    }

    private static RecoverySuccessEvent successEvent(Failure failure, RecoveryStrategy strategy, int retryCount,
            String checkpointUsed, String newSessionId, String agentType) {
        return RecoverySuccessEvent.builder()
                .workspaceId(failure.getWorkspaceId())
                .projectId(failure.getProjectId())
                .storyId(failure.getStoryId())
                .agentId(failure.getAgentId())
                .failureId(failure.getId())
                .strategy(strategy)
                .retryCount(retryCount)
                .previousSessionId(failure.getSessionId())
                .newSessionId(newSessionId)
                .agentType(agentType)
                .checkpointUsed(checkpointUsed)
                .timestamp(Instant.now())
                .build();
    }

    private static RecoveryResult skipped(Failure failure, String reason) {
        return RecoveryResult.builder()
                .success(false)
                .failureId(failure.getId())
                .retryCount(failure.getRetryCount())
                .error(reason)
                .build();
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private enum Claim {
        AUTOMATIC,
        MANUAL
    }
}
