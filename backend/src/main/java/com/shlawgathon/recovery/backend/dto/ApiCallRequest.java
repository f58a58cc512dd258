package com.shlawgathon.recovery.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a model API call made by the agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Model API call outcome")
public class ApiCallRequest {

    @Schema(description = "Session ID")
    private String sessionId;

    @Schema(description = "HTTP status code", example = "429")
    private int statusCode;

    @Schema(description = "Error message", example = "Rate limited")
    private String errorMessage;
}
