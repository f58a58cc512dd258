package com.shlawgathon.recovery.backend.events;

import com.shlawgathon.recovery.backend.model.RecoveryStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Payload of {@code agent:recovery_attempt}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryAttemptEvent {

    private String workspaceId;
    private String projectId;
    private String storyId;
    private String agentId;
    private String failureId;

    private RecoveryStrategy strategy;
    private int retryCount;

    private String checkpointUsed;

    private Instant timestamp;
}
