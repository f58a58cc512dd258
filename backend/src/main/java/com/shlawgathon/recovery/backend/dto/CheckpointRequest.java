package com.shlawgathon.recovery.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Checkpoint data reported after a verified commit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Verified commit to record as a resume point")
public class CheckpointRequest {

    @Schema(description = "Agent that produced the commit", example = "agent-001")
    private String agentId;

    @Schema(description = "Owning project", example = "proj-789")
    private String projectId;

    @Schema(description = "Owning workspace", example = "ws-456")
    private String workspaceId;

    @Schema(description = "Story the session is working on", example = "story-11-9")
    private String storyId;

    @NotBlank
    @Schema(description = "Commit hash", example = "a1b2c3d")
    private String commitHash;

    @Schema(description = "Branch name", example = "feature/story-11-9")
    private String branch;

    @Schema(description = "Files touched by the commit")
    private List<String> filesModified;

    @Schema(description = "Whether the test suite passed on this commit")
    private boolean testsPassed;

    @Schema(description = "Human-readable description", example = "Implemented retry policy")
    private String description;
}
