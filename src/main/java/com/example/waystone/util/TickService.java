package com.example.waystone.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic game tick.
 *
 * Named callbacks run one after another, in registration order, on a single
 * scheduler thread. A callback that throws, Errors included, is logged;
 * the rest of the tick and every later tick still run.
 */
public class TickService {
    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, Runnable> callbacks = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, AtomicLong> failures = new ConcurrentHashMap<>();
    private final AtomicLong tickCount = new AtomicLong();
    private volatile ScheduledFuture<?> future;

    public TickService() {
        // single-threaded scheduler to serialize tick operations
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "waystone-tick");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Add a callback to every tick. Re-registering a name replaces it.
     */
    public void register(String name, Runnable callback) {
        callbacks.put(name, callback);
        logger.debug("Tick callback '{}' registered", name);
    }

    public boolean unregister(String name) {
        return callbacks.remove(name) != null;
    }

    /**
     * Start ticking. The first tick fires one interval from now.
     */
    public synchronized void start(long intervalMs) {
        if (future != null) {
            throw new IllegalStateException("Tick loop already started");
        }
        future = scheduler.scheduleAtFixedRate(this::runTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("Tick loop started with {}ms interval, callbacks {}", intervalMs, callbacks.keySet());
    }

    /**
     * Run every callback once, in order.
     */
    public void runTick() {
        long n = tickCount.incrementAndGet();
        Map<String, Runnable> snapshot;
        synchronized (callbacks) {
            snapshot = new LinkedHashMap<>(callbacks);
        }
        for (Map.Entry<String, Runnable> e : snapshot.entrySet()) {
            try {
                e.getValue().run();
            } catch (Throwable ex) {
                // an escaping Error would cancel the fixed-rate schedule
                failures.computeIfAbsent(e.getKey(), k -> new AtomicLong()).incrementAndGet();
                logger.error("Tick {} callback '{}' failed: {}", n, e.getKey(), ex.getMessage(), ex);
            }
        }
    }

    public long getTickCount() {
        return tickCount.get();
    }

    public long getFailureCount(String name) {
        AtomicLong count = failures.get(name);
        return count == null ? 0 : count.get();
    }

    public synchronized void shutdown() {
        if (future != null) {
            future.cancel(false);
        }
        scheduler.shutdownNow();
        logger.info("Tick loop stopped after {} ticks", tickCount.get());
    }
}
