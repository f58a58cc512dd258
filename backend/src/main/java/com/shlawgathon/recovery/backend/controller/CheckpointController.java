package com.shlawgathon.recovery.backend.controller;

import com.shlawgathon.recovery.backend.model.Checkpoint;
import com.shlawgathon.recovery.backend.service.CheckpointService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Checkpoints", description = "Resume points of sessions and stories")
public class CheckpointController {

    private final CheckpointService checkpointService;

    public CheckpointController(CheckpointService checkpointService) {
        this.checkpointService = checkpointService;
    }

    @GetMapping("/sessions/{sessionId}/checkpoints")
    @Operation(summary = "Session checkpoints", description = "All checkpoints of a session, newest first")
    public ResponseEntity<List<Checkpoint>> getSessionCheckpoints(@PathVariable String sessionId) {
        return ResponseEntity.ok(checkpointService.getSessionCheckpoints(sessionId));
    }

    @GetMapping("/workspaces/{workspaceId}/stories/{storyId}/checkpoint")
    @Operation(summary = "Latest story checkpoint", description = "Newest checkpoint written for a story by any session")
    public ResponseEntity<Checkpoint> getStoryCheckpoint(
            @PathVariable String workspaceId,
            @PathVariable String storyId) {
        return checkpointService.getLatestStoryCheckpoint(workspaceId, storyId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
