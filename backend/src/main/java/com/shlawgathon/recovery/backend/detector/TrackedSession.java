package com.shlawgathon.recovery.backend.detector;

import com.shlawgathon.recovery.backend.dto.SessionRegistration;

import java.util.HashMap;
import java.util.Map;

/**
 * Detector-side state of one live session.
 * All mutable state is guarded by the instance monitor, so the deadline callback and
 * signal handlers for the same session never interleave.
 */
public final class TrackedSession {

    private final String sessionId;
    private final String agentId;
    private final String agentType;
    private final String projectId;
    private final String workspaceId;
    private final String storyId;

    private final int fileModificationLoopThreshold;
    private final ConsecutiveCounter apiErrors;
    // file path -> consecutive edits without passing tests
    private final Map<String, ConsecutiveCounter> fileEdits = new HashMap<>();

    private SessionDeadlines.Cancellable deadline;
    private boolean closed;

    TrackedSession(SessionRegistration registration, DetectionThresholds thresholds) {
        this.sessionId = registration.getSessionId();
        this.agentId = registration.getAgentId();
        this.agentType = registration.getAgentType();
        this.projectId = registration.getProjectId();
        this.workspaceId = registration.getWorkspaceId();
        this.storyId = registration.getStoryId();
        this.fileModificationLoopThreshold = thresholds.fileModificationLoopThreshold();
        this.apiErrors = new ConsecutiveCounter(thresholds.apiErrorThreshold());
    }

    /**
     * @return true when this call crossed the consecutive API error threshold
     */
    synchronized boolean recordApiCall(boolean success) {
        if (success) {
            apiErrors.onSuccess();
            return false;
        }
        return apiErrors.onFailure();
    }

    /**
     * @return true when this edit crossed the loop threshold for the file
     */
    synchronized boolean recordFileEdit(String filePath, boolean testsPassed) {
        if (testsPassed) {
            ConsecutiveCounter counter = fileEdits.get(filePath);
            if (counter != null) {
                counter.onSuccess();
            }
            return false;
        }
        return fileEdits.computeIfAbsent(filePath, k -> new ConsecutiveCounter(fileModificationLoopThreshold))
                .onFailure();
    }

    synchronized void armDeadline(SessionDeadlines.Cancellable handle) {
        if (closed) {
            handle.cancel();
            return;
        }
        this.deadline = handle;
    }

    /**
     * Called from the deadline callback.
     *
     * @return false when the session was closed first and no timeout may be raised
     */
    synchronized boolean fireDeadline() {
        if (closed) {
            return false;
        }
        deadline = null;
        return true;
    }

    /**
     * Stop tracking: cancels the pending deadline. Idempotent.
     */
    synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (deadline != null) {
            deadline.cancel();
            deadline = null;
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getAgentType() {
        return agentType;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getStoryId() {
        return storyId;
    }
}
