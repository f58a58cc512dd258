package com.shlawgathon.recovery.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stall notice from the output watchdog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Session produced no output for too long")
public class SessionStalledRequest {

    @Schema(description = "Session ID")
    private String sessionId;

    @Schema(description = "Time of the last observed output")
    private Instant lastActivityTimestamp;

    @Schema(description = "How long the session has been silent, in milliseconds", example = "600000")
    private long stallDurationMs;
}
