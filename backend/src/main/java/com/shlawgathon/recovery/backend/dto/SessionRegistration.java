package com.shlawgathon.recovery.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters for starting failure monitoring of a session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Session to start monitoring")
public class SessionRegistration {

    @NotBlank
    @Schema(description = "Session ID", example = "session-123")
    private String sessionId;

    @Schema(description = "Agent ID", example = "agent-001")
    private String agentId;

    @Schema(description = "Agent type", example = "dev")
    private String agentType;

    @Schema(description = "Owning project", example = "proj-789")
    private String projectId;

    @Schema(description = "Owning workspace", example = "ws-456")
    private String workspaceId;

    @Schema(description = "Story the session works on", example = "story-11-9")
    private String storyId;

    @Schema(description = "Maximum session duration in milliseconds (defaults to the configured maximum)")
    private Long maxDurationMs;
}
