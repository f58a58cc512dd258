package com.shlawgathon.recovery.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A file edit made by the agent and the test outcome that followed it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "File edit outcome")
public class FileEditRequest {

    @Schema(description = "Session ID")
    private String sessionId;

    @Schema(description = "Edited file path", example = "src/app.ts")
    private String filePath;

    @Schema(description = "Whether tests passed after the edit")
    private boolean testsPassed;
}
