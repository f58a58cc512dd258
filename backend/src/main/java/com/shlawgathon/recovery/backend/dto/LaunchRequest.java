package com.shlawgathon.recovery.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to launch a replacement agent session on the agent module.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to launch an agent session")
public class LaunchRequest {

    @Schema(description = "Agent type to launch", example = "dev")
    private String agentType;

    @Schema(description = "Agent ID to reuse")
    private String agentId;

    @Schema(description = "Owning project")
    private String projectId;

    @Schema(description = "Owning workspace")
    private String workspaceId;

    @Schema(description = "Story to work on")
    private String storyId;

    @Schema(description = "Checkpoint to resume from (null for a fresh start)")
    private ResumeCheckpoint resumeFrom;

    @Schema(description = "Regenerate context files before starting")
    private boolean refreshContext;

    @Schema(description = "Human guidance to include in the session prompt")
    private String guidance;
}
