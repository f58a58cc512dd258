package com.shlawgathon.recovery.backend.events;

import com.shlawgathon.recovery.backend.model.FailureType;
import com.shlawgathon.recovery.backend.model.ManualOverrideAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Payload of {@code agent:recovery_escalation}: automatic recovery gave up and a human must decide.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryEscalationEvent {

    private String workspaceId;
    private String projectId;
    private String storyId;
    private String agentId;
    private String failureId;

    private int totalRetries;

    private FailureType lastFailureType;
    private String lastErrorDetails;

    @Builder.Default
    private List<ManualOverrideAction> overrideOptions = new ArrayList<>();

    private Instant timestamp;
}
