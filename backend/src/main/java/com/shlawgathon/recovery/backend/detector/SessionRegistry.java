package com.shlawgathon.recovery.backend.detector;

import java.util.Collection;
import java.util.Optional;

/**
 * Storage of tracked sessions, one per live session id.
 * <p>
 * The {@link FailureDetector} is the only writer. Other components may read through the
 * detector but must never mutate a {@link TrackedSession}.
 */
public interface SessionRegistry {

    /**
     * Store a session, returning the one it replaced under the same id, if any.
     */
    Optional<TrackedSession> put(TrackedSession session);

    /**
     * Empty for a {@code null} id.
     */
    Optional<TrackedSession> find(String sessionId);

    Optional<TrackedSession> remove(String sessionId);

    /**
     * Remove only if the id still maps to this exact session.
     */
    boolean remove(String sessionId, TrackedSession session);

    Collection<TrackedSession> all();
}
