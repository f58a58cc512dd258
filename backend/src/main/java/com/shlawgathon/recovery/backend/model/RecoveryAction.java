package com.shlawgathon.recovery.backend.model;

/**
 * What the recovery orchestrator has done (or is doing) about a failure.
 */
public enum RecoveryAction {
    PENDING,
    RETRY,
    CHECKPOINT_RECOVERY,
    CONTEXT_REFRESH,
    ESCALATED,
    MANUAL_OVERRIDE
}
