package com.shlawgathon.recovery.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Process exit reported by the supervisor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Agent process exit")
public class ProcessExitRequest {

    @Schema(description = "Session ID")
    private String sessionId;

    @Schema(description = "Exit code, null when killed by a signal", example = "137")
    private Integer exitCode;

    @Schema(description = "Terminating signal", example = "SIGKILL")
    private String signal;

    @Schema(description = "Tail of the process stderr", example = "Killed")
    private String stderr;
}
