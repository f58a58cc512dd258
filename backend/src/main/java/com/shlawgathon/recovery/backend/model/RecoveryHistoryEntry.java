package com.shlawgathon.recovery.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Audit record of a single recovery attempt, escalation or manual override.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "recovery_history")
public class RecoveryHistoryEntry {

    @Id
    private String id;

    private String failureId;

    private String workspaceId;

    @Indexed
    private String projectId;

    private String storyId;
    private String sessionId;
    private String agentId;
    private String agentType;

    private FailureType failureType;
    private RecoveryStrategy strategy;

    private int retryCount;

    private String checkpointCommitHash;

    private boolean success;

    private String errorDetails;

    private long durationMs;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @CreatedDate
    private Instant createdAt;
}
