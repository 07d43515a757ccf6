package com.example.waystone.net;

import com.example.waystone.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SessionManager Tests")
public class SessionManagerTest {

    private MutableClock clock;
    private SessionManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        manager = new SessionManager(clock);
    }

    private static TelnetConnection newConnection() {
        return new TelnetConnection(new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream(), "10.0.0.1", 64);
    }

    @Test
    @DisplayName("created sessions can be looked up by id")
    void createAndGet() {
        Session s = manager.createSession(newConnection());
        assertTrue(manager.getSession(s.getId()).isPresent());
        assertEquals(1, manager.getSessionCount());
    }

    @Test
    @DisplayName("lookups of unknown or null ids are empty")
    void unknownLookups() {
        assertTrue(manager.getSession(UUID.randomUUID()).isEmpty());
        assertTrue(manager.getSession(null).isEmpty());
        assertTrue(manager.getSessionByUser(null).isEmpty());
        assertTrue(manager.getSessionByUser("nobody").isEmpty());
    }

    @Test
    @DisplayName("getSessionByUser finds the session bound to the user")
    void byUser() {
        Session a = manager.createSession(newConnection());
        manager.createSession(newConnection());
        a.setUser("user-a");
        assertSame(a, manager.getSessionByUser("user-a").orElseThrow());
    }

    @Test
    @DisplayName("destroySession marks DISCONNECTED, removes and notifies once")
    void destroy() {
        Session s = manager.createSession(newConnection());
        List<Session> notified = new ArrayList<>();
        manager.addDestroyListener(notified::add);

        assertTrue(manager.destroySession(s.getId()));
        assertFalse(manager.destroySession(s.getId()));

        assertEquals(SessionState.DISCONNECTED, s.getState());
        assertTrue(manager.getSession(s.getId()).isEmpty());
        assertEquals(List.of(s), notified);
    }

    @Test
    @DisplayName("destroying an unknown id is a no-op")
    void destroyUnknown() {
        assertFalse(manager.destroySession(UUID.randomUUID()));
        assertFalse(manager.destroySession(null));
    }

    @Test
    @DisplayName("a failing destroy listener does not stop the others")
    void failingListener() {
        Session s = manager.createSession(newConnection());
        AtomicInteger calls = new AtomicInteger();
        manager.addDestroyListener(x -> { throw new IllegalStateException("boom"); });
        manager.addDestroyListener(x -> calls.incrementAndGet());
        assertTrue(manager.destroySession(s.getId()));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("cleanupExpired removes only idle sessions")
    void cleanupExpired() {
        Session idle = manager.createSession(newConnection());
        Session active = manager.createSession(newConnection());
        clock.advance(Duration.ofMinutes(61));
        active.updateActivity();

        assertEquals(1, manager.cleanupExpired(60));
        assertTrue(manager.getSession(idle.getId()).isEmpty());
        assertTrue(manager.getSession(active.getId()).isPresent());
        assertEquals(0, manager.cleanupExpired(60));
    }

    @Test
    @DisplayName("getAllSessions returns a copy")
    void allSessionsIsCopy() {
        manager.createSession(newConnection());
        List<Session> all = manager.getAllSessions();
        manager.createSession(newConnection());
        assertEquals(1, all.size());
        assertEquals(2, manager.getSessionCount());
    }

    @Test
    @DisplayName("concurrent creates and destroys leave a consistent registry")
    void concurrentAccess() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        int perThread = 50;
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            pool.submit(() -> {
                try {
                    for (int i = 0; i < perThread; i++) {
                        Session s = manager.createSession(newConnection());
                        if (i % 2 == 0) manager.destroySession(s.getId());
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(8 * perThread / 2, manager.getSessionCount());
    }
}
