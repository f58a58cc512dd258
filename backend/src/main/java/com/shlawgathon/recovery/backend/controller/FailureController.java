package com.shlawgathon.recovery.backend.controller;

import com.shlawgathon.recovery.backend.detector.FailureDetector;
import com.shlawgathon.recovery.backend.dto.HistoryPage;
import com.shlawgathon.recovery.backend.model.Failure;
import com.shlawgathon.recovery.backend.model.ManualOverrideParams;
import com.shlawgathon.recovery.backend.model.PipelineRecoveryStatus;
import com.shlawgathon.recovery.backend.model.RecoveryResult;
import com.shlawgathon.recovery.backend.recovery.RecoveryOrchestrator;
import com.shlawgathon.recovery.backend.service.RecoveryHistoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api")
@Tag(name = "Failures", description = "Failure and recovery monitoring")
public class FailureController {

    private final FailureDetector failureDetector;
    private final RecoveryOrchestrator recoveryOrchestrator;
    private final RecoveryHistoryService historyService;

    public FailureController(FailureDetector failureDetector,
            RecoveryOrchestrator recoveryOrchestrator,
            RecoveryHistoryService historyService) {
        this.failureDetector = failureDetector;
        this.recoveryOrchestrator = recoveryOrchestrator;
        this.historyService = historyService;
    }

    @GetMapping("/failures/active")
    @Operation(summary = "Active failures", description = "Unresolved failures, oldest first")
    public ResponseEntity<List<Failure>> getActiveFailures() {
        return ResponseEntity.ok(failureDetector.getActiveFailures());
    }

    @GetMapping("/failures")
    @Operation(summary = "Recovery history", description = "Recovery attempts, escalations and overrides, newest first")
    public ResponseEntity<HistoryPage> getHistory(
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(historyService.page(limit, offset));
    }

    @PostMapping("/failures/{failureId}/override")
    @Operation(summary = "Manual override", description = "Terminate, reassign or guide the session of an open failure")
    public CompletableFuture<ResponseEntity<RecoveryResult>> override(
            @PathVariable String failureId,
            @RequestBody ManualOverrideParams params) {
        params.setFailureId(failureId);
        return recoveryOrchestrator.handleManualOverride(params).thenApply(ResponseEntity::ok);
    }

    @GetMapping("/projects/{projectId}/recovery-status")
    @Operation(summary = "Pipeline recovery status", description = "Active failures, recent history and retry budget of a project")
    public ResponseEntity<PipelineRecoveryStatus> getRecoveryStatus(@PathVariable String projectId) {
        return ResponseEntity.ok(recoveryOrchestrator.getRecoveryStatus(projectId));
    }
}
