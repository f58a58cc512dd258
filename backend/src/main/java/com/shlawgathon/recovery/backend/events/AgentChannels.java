package com.shlawgathon.recovery.backend.events;

import java.util.List;

/**
 * Channel names carried by the {@link AgentEventBus}.
 */
public final class AgentChannels {

    public static final String FAILURE = "agent:failure";
    public static final String RECOVERY_ATTEMPT = "agent:recovery_attempt";
    public static final String RECOVERY_SUCCESS = "agent:recovery_success";
    public static final String RECOVERY_ESCALATION = "agent:recovery_escalation";

    public static final List<String> ALL = List.of(FAILURE, RECOVERY_ATTEMPT, RECOVERY_SUCCESS, RECOVERY_ESCALATION);

    private AgentChannels() {
    }
}
