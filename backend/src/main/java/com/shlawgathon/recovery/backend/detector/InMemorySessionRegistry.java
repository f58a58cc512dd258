package com.shlawgathon.recovery.backend.detector;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemorySessionRegistry implements SessionRegistry {

    private final Map<String, TrackedSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<TrackedSession> put(TrackedSession session) {
        return Optional.ofNullable(sessions.put(session.getSessionId(), session));
    }

    @Override
    public Optional<TrackedSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<TrackedSession> remove(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    @Override
    public boolean remove(String sessionId, TrackedSession session) {
        return sessions.remove(sessionId, session);
    }

    @Override
    public Collection<TrackedSession> all() {
        return List.copyOf(sessions.values());
    }
}
