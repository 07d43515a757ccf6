package com.example.waystone.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Directory of live sessions.
 *
 * Lookups report absence with an empty {@link Optional}; nothing here throws
 * for a missing session.
 */
public class SessionManager {
    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final Map<UUID, Session> sessions = new ConcurrentHashMap<>();
    private final List<Consumer<Session>> destroyListeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public SessionManager() {
        this(Clock.systemUTC());
    }

    public SessionManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Create a session for a freshly accepted connection and bind the two together.
     */
    public Session createSession(TelnetConnection connection) {
        Session session = new Session(connection, clock);
        sessions.put(session.getId(), session);
        connection.setSession(session);
        logger.debug("Session {} registered, {} live", session.getId(), sessions.size());
        return session;
    }

    public Optional<Session> getSession(UUID sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<Session> getSessionByUser(String userId) {
        if (userId == null) return Optional.empty();
        for (Session s : sessions.values()) {
            if (userId.equals(s.getUserId())) return Optional.of(s);
        }
        return Optional.empty();
    }

    /**
     * Mark a session disconnected and drop it.
     *
     * @return true if the session was live, false if it was already gone
     */
    public boolean destroySession(UUID sessionId) {
        if (sessionId == null) return false;
        Session session = sessions.remove(sessionId);
        if (session == null) return false;
        session.setState(SessionState.DISCONNECTED);
        logger.info("Session {} destroyed, {} live", sessionId, sessions.size());
        for (Consumer<Session> listener : destroyListeners) {
            try {
                listener.accept(session);
            } catch (RuntimeException e) {
                logger.error("Session destroy listener failed for {}: {}", sessionId, e.getMessage(), e);
            }
        }
        return true;
    }

    /**
     * Destroy every session idle for longer than the timeout.
     *
     * @return number of sessions destroyed
     */
    public int cleanupExpired(int timeoutMinutes) {
        List<UUID> expired = new ArrayList<>();
        for (Session s : sessions.values()) {
            if (s.isExpired(timeoutMinutes)) expired.add(s.getId());
        }
        int removed = 0;
        for (UUID id : expired) {
            if (destroySession(id)) removed++;
        }
        if (removed > 0) {
            logger.info("Expired {} idle session(s) (timeout {}m)", removed, timeoutMinutes);
        }
        return removed;
    }

    /**
     * Called with each session after it has been destroyed, whatever the cause.
     */
    public void addDestroyListener(Consumer<Session> listener) {
        destroyListeners.add(listener);
    }

    public List<Session> getAllSessions() {
        return new ArrayList<>(sessions.values());
    }

    public int getSessionCount() {
        return sessions.size();
    }
}
