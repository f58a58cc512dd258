package com.shlawgathon.recovery.backend.model;

/**
 * Actions a human can take on an escalated failure.
 */
public enum ManualOverrideAction {
    TERMINATE,
    REASSIGN,
    PROVIDE_GUIDANCE
}
