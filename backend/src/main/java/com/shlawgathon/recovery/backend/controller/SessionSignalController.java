package com.shlawgathon.recovery.backend.controller;

import com.shlawgathon.recovery.backend.detector.FailureDetector;
import com.shlawgathon.recovery.backend.dto.ApiCallRequest;
import com.shlawgathon.recovery.backend.dto.CheckpointRequest;
import com.shlawgathon.recovery.backend.dto.FileEditRequest;
import com.shlawgathon.recovery.backend.dto.ProcessExitRequest;
import com.shlawgathon.recovery.backend.dto.SessionRegistration;
import com.shlawgathon.recovery.backend.dto.SessionStalledRequest;
import com.shlawgathon.recovery.backend.model.Checkpoint;
import com.shlawgathon.recovery.backend.model.Failure;
import com.shlawgathon.recovery.backend.service.CheckpointService;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Lifecycle signals from the process supervisor.
 * Each signal endpoint answers 200 with the raised failure, or 204 when none was raised.
 */
@RestController
@RequestMapping("/internal/sessions")
@Tag(name = "Internal", description = "Internal callbacks from the process supervisor")
@Hidden
public class SessionSignalController {

    private static final Logger log = LoggerFactory.getLogger(SessionSignalController.class);

    private final FailureDetector failureDetector;
    private final CheckpointService checkpointService;

    public SessionSignalController(FailureDetector failureDetector, CheckpointService checkpointService) {
        this.failureDetector = failureDetector;
        this.checkpointService = checkpointService;
    }

    @PostMapping
    @Operation(summary = "Register session", description = "Start failure monitoring for a session")
    public ResponseEntity<Void> registerSession(@Valid @RequestBody SessionRegistration registration) {
        failureDetector.registerSession(registration);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @DeleteMapping("/{sessionId}")
    @Operation(summary = "Unregister session", description = "Stop monitoring a session that ended")
    public ResponseEntity<Void> unregisterSession(@PathVariable String sessionId) {
        failureDetector.unregisterSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionId}/exit")
    @Operation(summary = "Process exit", description = "Report the exit of a session's process")
    public ResponseEntity<Failure> processExit(
            @PathVariable String sessionId,
            @RequestBody ProcessExitRequest request) {
        request.setSessionId(sessionId);
        return toResponse(failureDetector.handleProcessExit(request));
    }

    @PostMapping("/{sessionId}/api-calls")
    @Operation(summary = "API call result", description = "Report the outcome of an API call made by the agent")
    public ResponseEntity<Failure> apiCall(
            @PathVariable String sessionId,
            @RequestBody ApiCallRequest request) {
        request.setSessionId(sessionId);
        return toResponse(failureDetector.handleApiError(request));
    }

    @PostMapping("/{sessionId}/file-edits")
    @Operation(summary = "File edit", description = "Report a file edit and whether tests passed afterwards")
    public ResponseEntity<Failure> fileEdit(
            @PathVariable String sessionId,
            @RequestBody FileEditRequest request) {
        request.setSessionId(sessionId);
        return toResponse(failureDetector.handleFileModification(request));
    }

    @PostMapping("/{sessionId}/stalled")
    @Operation(summary = "Session stalled", description = "Report that a session produced no output for too long")
    public ResponseEntity<Failure> stalled(
            @PathVariable String sessionId,
            @RequestBody SessionStalledRequest request) {
        request.setSessionId(sessionId);
        return toResponse(failureDetector.handleSessionStalled(request));
    }

    @PostMapping("/{sessionId}/checkpoints")
    @Operation(summary = "Save checkpoint", description = "Record a verified commit as a resume point")
    public ResponseEntity<Checkpoint> saveCheckpoint(
            @PathVariable String sessionId,
            @Valid @RequestBody CheckpointRequest request) {
        Checkpoint checkpoint = checkpointService.createCheckpoint(sessionId, request);
        log.info("[CHECKPOINT] Session: {} | Saved checkpoint: {}", sessionId, checkpoint.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(checkpoint);
    }

    private static ResponseEntity<Failure> toResponse(Failure failure) {
        return failure != null ? ResponseEntity.ok(failure) : ResponseEntity.noContent().build();
    }
}
