package com.shlawgathon.recovery.backend.dto;

import com.shlawgathon.recovery.backend.model.Checkpoint;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Checkpoint data for resuming a story in a new session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Checkpoint to resume from")
public class ResumeCheckpoint {

    @Schema(description = "Checkpoint ID")
    private String checkpointId;

    @Schema(description = "Commit to check out")
    private String commitHash;

    @Schema(description = "Branch holding the commit")
    private String branch;

    @Schema(description = "Files the previous session touched")
    private List<String> filesModified;

    public static ResumeCheckpoint from(Checkpoint checkpoint) {
        if (checkpoint == null) {
            return null;
        }
        return ResumeCheckpoint.builder()
                .checkpointId(checkpoint.getId())
                .commitHash(checkpoint.getCommitHash())
                .branch(checkpoint.getBranch())
                .filesModified(checkpoint.getFilesModified())
                .build();
    }
}
