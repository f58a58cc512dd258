package com.shlawgathon.recovery.backend.recovery;

import com.shlawgathon.recovery.backend.dto.LaunchRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the process supervisor that starts and stops agent sessions.
 */
public interface SessionLauncher {

    /**
     * Start a session.
     *
     * @return the new session id, or a future failed with {@link SessionLaunchException}
     */
    CompletableFuture<String> launchSession(LaunchRequest request);

    CompletableFuture<Void> terminateSession(String sessionId);
}
