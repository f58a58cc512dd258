package com.shlawgathon.recovery.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A classified failure of an agent session.
 * Created by the failure detector; only the detector changes its recovery action
 * and resolved flag afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Failure {

    private String id;

    private String sessionId;
    private String agentId;
    private String agentType;
    private String projectId;
    private String workspaceId;
    private String storyId;

    private FailureType failureType;

    private int retryCount;

    /**
     * Commit hash of the session's latest checkpoint when the failure was raised.
     */
    private String lastCheckpoint;

    private String errorDetails;

    @Builder.Default
    private volatile RecoveryAction recoveryAction = RecoveryAction.PENDING;

    private volatile boolean resolved;

    private Instant timestamp;

    /**
     * Extra classification data, e.g. HTTP status code or offending file path.
     */
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
