package com.shlawgathon.recovery.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A verified, test-passing commit recorded as a safe resume point.
 * Stored as JSON in Redis; immutable once written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checkpoint {

    private String id;

    private String sessionId;
    private String agentId;
    private String projectId;
    private String workspaceId;
    private String storyId;

    // Git state
    private String commitHash;
    private String branch;

    @Builder.Default
    private List<String> filesModified = new ArrayList<>();

    private boolean testsPassed;

    private String description;

    private Instant createdAt;
}
