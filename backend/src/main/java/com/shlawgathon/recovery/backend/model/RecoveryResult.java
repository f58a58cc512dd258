package com.shlawgathon.recovery.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of handling a failure or a manual override.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryResult {

    private boolean success;

    // Null when the failure was discarded without action
    private RecoveryStrategy strategy;

    private String failureId;
    private int retryCount;

    private String newSessionId;
    private String checkpointUsed;

    private String error;
}
