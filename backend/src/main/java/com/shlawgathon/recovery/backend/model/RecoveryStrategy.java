package com.shlawgathon.recovery.backend.model;

/**
 * Strategies the recovery orchestrator can apply to a failure.
 */
public enum RecoveryStrategy {
    RETRY(RecoveryAction.RETRY),
    CHECKPOINT_RECOVERY(RecoveryAction.CHECKPOINT_RECOVERY),
    CONTEXT_REFRESH(RecoveryAction.CONTEXT_REFRESH),
    ESCALATION(RecoveryAction.ESCALATED),
    MANUAL_OVERRIDE(RecoveryAction.MANUAL_OVERRIDE);

    private final RecoveryAction action;

    RecoveryStrategy(RecoveryAction action) {
        this.action = action;
    }

    public RecoveryAction toAction() {
        return action;
    }

    /**
     * Whether this strategy starts a replacement session automatically.
     */
    public boolean relaunches() {
        return this == RETRY || this == CHECKPOINT_RECOVERY || this == CONTEXT_REFRESH;
    }
}
