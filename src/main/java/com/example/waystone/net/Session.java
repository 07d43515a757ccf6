package com.example.waystone.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Authentication and play state bound to exactly one connection.
 */
public class Session {
    private static final Logger logger = LoggerFactory.getLogger(Session.class);

    private final UUID id = UUID.randomUUID();
    private final TelnetConnection connection;
    private final Clock clock;
    private final Instant createdAt;

    private volatile String userId;
    private volatile String characterId;
    private volatile SessionState state = SessionState.CONNECTED;
    private volatile Instant lastActivity;

    Session(TelnetConnection connection, Clock clock) {
        this.connection = connection;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActivity = createdAt;
        logger.info("Session {} created for connection {} ({})", id, connection.getId(), connection.getRemoteAddress());
    }

    public UUID getId() { return id; }
    public TelnetConnection getConnection() { return connection; }
    public String getUserId() { return userId; }
    public String getCharacterId() { return characterId; }
    public SessionState getState() { return state; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastActivity() { return lastActivity; }

    public boolean hasCharacter() {
        return characterId != null;
    }

    public void updateActivity() {
        lastActivity = clock.instant();
    }

    public void setUser(String userId) {
        this.userId = userId;
        updateActivity();
        logger.info("Session {} user set to {}", id, userId);
    }

    public void setCharacter(String characterId) {
        this.characterId = characterId;
        updateActivity();
        logger.info("Session {} character set to {}", id, characterId);
    }

    /**
     * Move to a new state.
     *
     * @throws IllegalStateException if the session is already disconnected
     */
    public synchronized void setState(SessionState newState) {
        SessionState old = this.state;
        if (old == SessionState.DISCONNECTED && newState != SessionState.DISCONNECTED) {
            throw new IllegalStateException("Session " + id + " is disconnected");
        }
        this.state = newState;
        updateActivity();
        logger.info("Session {} state {} -> {}", id, old.getDisplayName(), newState.getDisplayName());
    }

    /** Forget the logged-in user and character (logout). */
    public void clearIdentity() {
        this.characterId = null;
        this.userId = null;
        updateActivity();
    }

    public boolean isExpired(int timeoutMinutes) {
        Duration idle = Duration.between(lastActivity, clock.instant());
        return idle.compareTo(Duration.ofMinutes(timeoutMinutes)) > 0;
    }

    @Override
    public String toString() {
        return "Session(" + id + ", " + state.getDisplayName() + ")";
    }
}
