package com.shlawgathon.recovery.backend.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A human decision on an escalated failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Manual override of an escalated failure")
public class ManualOverrideParams {

    @Schema(description = "Failure to act on")
    private String failureId;

    @Schema(description = "Override action", example = "REASSIGN")
    private ManualOverrideAction action;

    @Schema(description = "Instructions for the replacement session (PROVIDE_GUIDANCE)")
    private String guidance;

    @Schema(description = "Agent type to hand the story to (REASSIGN)", example = "qa")
    private String reassignToAgentType;

    @Schema(description = "User applying the override")
    private String userId;
}
