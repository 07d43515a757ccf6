package com.example.waystone.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TickService Tests")
public class TickServiceTest {

    private TickService ticks;

    @BeforeEach
    void setUp() {
        ticks = new TickService();
    }

    @AfterEach
    void tearDown() {
        ticks.shutdown();
    }

    @Test
    @DisplayName("callbacks run in registration order")
    void order() {
        List<String> calls = new ArrayList<>();
        ticks.register("first", () -> calls.add("first"));
        ticks.register("second", () -> calls.add("second"));
        ticks.register("third", () -> calls.add("third"));
        ticks.runTick();
        assertEquals(List.of("first", "second", "third"), calls);
        assertEquals(1, ticks.getTickCount());
    }

    @Test
    @DisplayName("a failing callback does not block the others")
    void failureIsolated() {
        List<String> calls = new ArrayList<>();
        ticks.register("before", () -> calls.add("before"));
        ticks.register("broken", () -> { throw new IllegalStateException("boom"); });
        ticks.register("after", () -> calls.add("after"));
        ticks.runTick();
        ticks.runTick();
        assertEquals(List.of("before", "after", "before", "after"), calls);
        assertEquals(2, ticks.getFailureCount("broken"));
        assertEquals(0, ticks.getFailureCount("after"));
    }

    @Test
    @DisplayName("a callback throwing an Error does not cancel later callbacks or ticks")
    void errorDoesNotStopTheLoop() throws Exception {
        CountDownLatch later = new CountDownLatch(3);
        ticks.register("overflow", () -> { throw new StackOverflowError("deep"); });
        ticks.register("after", later::countDown);
        ticks.start(20);
        assertTrue(later.await(5, TimeUnit.SECONDS), "later callback should keep running every tick");
        assertTrue(ticks.getTickCount() >= 3);
        assertTrue(ticks.getFailureCount("overflow") >= 3);
    }

    @Test
    @DisplayName("unregister removes a callback")
    void unregister() {
        List<String> calls = new ArrayList<>();
        ticks.register("once", () -> calls.add("once"));
        assertTrue(ticks.unregister("once"));
        assertFalse(ticks.unregister("once"));
        ticks.runTick();
        assertTrue(calls.isEmpty());
    }

    @Test
    @DisplayName("the scheduler fires ticks on its own thread")
    void scheduled() throws Exception {
        CountDownLatch latch = new CountDownLatch(3);
        List<String> threads = new ArrayList<>();
        ticks.register("count", () -> {
            synchronized (threads) {
                threads.add(Thread.currentThread().getName());
            }
            latch.countDown();
        });
        ticks.start(10);
        assertTrue(latch.await(5, TimeUnit.SECONDS));
        synchronized (threads) {
            assertEquals("waystone-tick", threads.get(0));
        }
        assertThrows(IllegalStateException.class, () -> ticks.start(10));
    }
}
