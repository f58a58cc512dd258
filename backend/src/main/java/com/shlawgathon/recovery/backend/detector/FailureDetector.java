package com.shlawgathon.recovery.backend.detector;

import com.shlawgathon.recovery.backend.dto.ApiCallRequest;
import com.shlawgathon.recovery.backend.dto.FileEditRequest;
import com.shlawgathon.recovery.backend.dto.ProcessExitRequest;
import com.shlawgathon.recovery.backend.dto.SessionRegistration;
import com.shlawgathon.recovery.backend.dto.SessionStalledRequest;
import com.shlawgathon.recovery.backend.events.AgentChannels;
import com.shlawgathon.recovery.backend.events.AgentEventBus;
import com.shlawgathon.recovery.backend.model.Checkpoint;
import com.shlawgathon.recovery.backend.model.Failure;
import com.shlawgathon.recovery.backend.model.FailureType;
import com.shlawgathon.recovery.backend.model.RecoveryAction;
import com.shlawgathon.recovery.backend.service.CheckpointService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks live agent sessions and classifies the moment one stops making progress.
 * <p>
 * Every failure is stored as active and published on {@code agent:failure}. A failure is
 * raised exactly once per threshold crossing; signal handlers never throw and return
 * {@code null} when no failure was raised.
 */
@Service
public class FailureDetector {

    private static final Logger log = LoggerFactory.getLogger(FailureDetector.class);

    public static final String UNKNOWN = "unknown";

    /**
     * Metadata key linking a failure raised by a failed recovery to the failure it tried to recover.
     */
    public static final String RECOVERY_OF = "recoveryOf";

    private final SessionRegistry sessions;
    private final FailureRegistry failures;
    private final SessionDeadlines deadlines;
    private final AgentEventBus eventBus;
    private final CheckpointService checkpointService;
    private final DetectionThresholds thresholds;

    public FailureDetector(SessionRegistry sessions,
            FailureRegistry failures,
            SessionDeadlines deadlines,
            AgentEventBus eventBus,
            CheckpointService checkpointService,
            DetectionThresholds thresholds) {
        this.sessions = sessions;
        this.failures = failures;
        this.deadlines = deadlines;
        this.eventBus = eventBus;
        this.checkpointService = checkpointService;
        this.thresholds = thresholds;
    }

    /**
     * Start tracking a session and arm its deadline. Re-registering an id replaces the previous record.
     */
    public void registerSession(SessionRegistration registration) {
        TrackedSession session = new TrackedSession(registration, thresholds);
        sessions.put(session).ifPresent(TrackedSession::close);

        Duration maxDuration = registration.getMaxDurationMs() != null && registration.getMaxDurationMs() > 0
                ? Duration.ofMillis(registration.getMaxDurationMs())
                : thresholds.maxSessionDuration();
        session.armDeadline(deadlines.schedule(maxDuration, () -> onDeadline(session, maxDuration)));

        log.info("[DETECTOR] Registered session: {} | Agent: {} ({}) | Story: {} | Max duration: {}",
                session.getSessionId(), session.getAgentId(), session.getAgentType(),
                session.getStoryId(), maxDuration);
    }

    /**
     * Stop tracking a session. The pending deadline is cancelled before this returns.
     */
    public void unregisterSession(String sessionId) {
        sessions.remove(sessionId).ifPresent(session -> {
            session.close();
            log.info("[DETECTOR] Unregistered session: {}", sessionId);
        });
    }

    public boolean isTracking(String sessionId) {
        return sessions.find(sessionId).isPresent();
    }

    public Failure handleProcessExit(ProcessExitRequest exit) {
        if (exit.getExitCode() != null && exit.getExitCode() == 0) {
            log.debug("[DETECTOR] Session {} exited cleanly", exit.getSessionId());
            return null;
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("exitCode", exit.getExitCode());
        metadata.put("signal", exit.getSignal());

        String details = String.format("Process exited with code %s (signal: %s): %s",
                exit.getExitCode(), exit.getSignal() != null ? exit.getSignal() : "none",
                exit.getStderr() != null ? exit.getStderr() : "");

        Optional<TrackedSession> session = sessions.find(exit.getSessionId());
        if (session.isEmpty()) {
            log.warn("[DETECTOR] Exit of untracked session {}, raising crash with unknown owner", exit.getSessionId());
            return raise(unknownOwner(exit.getSessionId(), FailureType.CRASH, details, metadata));
        }
        return raise(session.get(), FailureType.CRASH, details, metadata);
    }

    public Failure handleApiError(ApiCallRequest call) {
        Optional<TrackedSession> session = sessions.find(call.getSessionId());
        if (session.isEmpty()) {
            log.debug("[DETECTOR] API result for untracked session {} ignored", call.getSessionId());
            return null;
        }

        boolean success = call.getStatusCode() < 400;
        if (!session.get().recordApiCall(success)) {
            return null;
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("statusCode", call.getStatusCode());
        metadata.put("consecutiveErrors", thresholds.apiErrorThreshold());
        String details = String.format("%d consecutive API errors, last %d: %s",
                thresholds.apiErrorThreshold(), call.getStatusCode(),
                call.getErrorMessage() != null ? call.getErrorMessage() : "");
        return raise(session.get(), FailureType.API_ERROR, details, metadata);
    }

    public Failure handleFileModification(FileEditRequest edit) {
        Optional<TrackedSession> session = sessions.find(edit.getSessionId());
        if (session.isEmpty() || edit.getFilePath() == null) {
            log.debug("[DETECTOR] File edit for untracked session {} ignored", edit.getSessionId());
            return null;
        }

        if (!session.get().recordFileEdit(edit.getFilePath(), edit.isTestsPassed())) {
            return null;
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("filePath", edit.getFilePath());
        metadata.put("modificationCount", thresholds.fileModificationLoopThreshold());
        String details = String.format("%s modified %d times without passing tests",
                edit.getFilePath(), thresholds.fileModificationLoopThreshold());
        return raise(session.get(), FailureType.LOOP, details, metadata);
    }

    public Failure handleSessionStalled(SessionStalledRequest stall) {
        Optional<TrackedSession> session = sessions.find(stall.getSessionId());
        if (session.isEmpty()) {
            log.debug("[DETECTOR] Stall of untracked session {} ignored", stall.getSessionId());
            return null;
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("stallDurationMs", stall.getStallDurationMs());
        if (stall.getLastActivityTimestamp() != null) {
            metadata.put("lastActivity", stall.getLastActivityTimestamp().toString());
        }
        String details = String.format("No output for %d seconds", stall.getStallDurationMs() / 1000);
        return raise(session.get(), FailureType.STUCK, details, metadata);
    }

    /**
     * Raise a crash for a recovery whose replacement session could not be started.
     * The new failure carries the original owner ids and links back through {@link #RECOVERY_OF}.
     */
    public Failure reportRecoveryFailure(Failure original, Throwable cause) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(RECOVERY_OF, original.getId());
        metadata.put("originalFailureType", original.getFailureType().name());

        Failure failure = Failure.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(original.getSessionId())
                .agentId(original.getAgentId())
                .agentType(original.getAgentType())
                .projectId(original.getProjectId())
                .workspaceId(original.getWorkspaceId())
                .storyId(original.getStoryId())
                .failureType(FailureType.CRASH)
                .retryCount(original.getRetryCount() + 1)
                .lastCheckpoint(original.getLastCheckpoint())
                .errorDetails("Recovery failed: " + (cause != null ? cause.getMessage() : "unknown error"))
                .timestamp(Instant.now())
                .metadata(metadata)
                .build();
        return raise(failure);
    }

    /**
     * Unresolved failures, oldest first.
     */
    public List<Failure> getActiveFailures() {
        return failures.unresolved();
    }

    public Optional<Failure> getFailure(String failureId) {
        return failures.find(failureId);
    }

    public void recordRecoveryAction(String failureId, RecoveryAction action) {
        failures.find(failureId).ifPresent(failure -> failure.setRecoveryAction(action));
    }

    /**
     * Mark a failure resolved and evict it from the active set. Unknown ids are ignored.
     */
    public void resolveFailure(String failureId) {
        failures.remove(failureId).ifPresent(failure -> {
            failure.setResolved(true);
            log.info("[DETECTOR] Resolved failure: {} ({}) for session: {}",
                    failureId, failure.getFailureType(), failure.getSessionId());
        });
    }

    @PreDestroy
    public void shutdown() {
        for (TrackedSession session : sessions.all()) {
            sessions.remove(session.getSessionId(), session);
            session.close();
        }
    }

    private void onDeadline(TrackedSession session, Duration maxDuration) {
        if (!session.fireDeadline()) {
            return;
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("maxDurationMs", maxDuration.toMillis());
        String details = String.format("Session exceeded maximum duration of %d minutes", maxDuration.toMinutes());
        raise(session, FailureType.TIMEOUT, details, metadata);
    }

    private Failure raise(TrackedSession session, FailureType type, String details, Map<String, Object> metadata) {
        return raise(Failure.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(session.getSessionId())
                .agentId(session.getAgentId())
                .agentType(session.getAgentType())
                .projectId(session.getProjectId())
                .workspaceId(session.getWorkspaceId())
                .storyId(session.getStoryId())
                .failureType(type)
                .lastCheckpoint(lastCheckpointOf(session.getSessionId()))
                .errorDetails(details)
                .timestamp(Instant.now())
                .metadata(metadata)
                .build());
    }

    private Failure unknownOwner(String sessionId, FailureType type, String details, Map<String, Object> metadata) {
        return Failure.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId != null ? sessionId : UNKNOWN)
                .agentId(UNKNOWN)
                .agentType(UNKNOWN)
                .projectId(UNKNOWN)
                .workspaceId(UNKNOWN)
                .storyId(UNKNOWN)
                .failureType(type)
                .errorDetails(details)
                .timestamp(Instant.now())
                .metadata(metadata)
                .build();
    }

    private Failure raise(Failure failure) {
        failures.save(failure);
        log.warn("[DETECTOR] Failure {} | Type: {} | Session: {} | Project: {} | {}",
                failure.getId(), failure.getFailureType(), failure.getSessionId(),
                failure.getProjectId(), failure.getErrorDetails());
        eventBus.publish(AgentChannels.FAILURE, failure);
        return failure;
    }

    private String lastCheckpointOf(String sessionId) {
        try {
            return checkpointService.getLatestCheckpoint(sessionId)
                    .map(Checkpoint::getCommitHash)
                    .orElse(null);
        } catch (RuntimeException e) {
            log.error("[DETECTOR] Checkpoint lookup failed for session: {}", sessionId, e);
            return null;
        }
    }
}
