package com.shlawgathon.recovery.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Recovery state of one project's pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRecoveryStatus {

    private String projectId;

    @Builder.Default
    private List<Failure> activeFailures = new ArrayList<>();

    // Newest first
    @Builder.Default
    private List<RecoveryHistoryEntry> recoveryHistory = new ArrayList<>();

    private boolean escalated;

    private int totalRetries;
    private int maxRetries;
}
