package com.example.waystone.engine;

import com.example.waystone.net.TelnetConnection;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

/**
 * Pending lines for one recipient. Lines go out in the order they were
 * offered, one drain task at a time, so a recipient that stops reading only
 * ever ties up its own task.
 */
final class OutboundQueue {
    private final TelnetConnection connection;
    private final Executor executor;
    private final int capacity;
    private final Deque<String> pending = new ArrayDeque<>();
    private boolean draining;

    OutboundQueue(TelnetConnection connection, Executor executor, int capacity) {
        this.connection = connection;
        this.executor = executor;
        this.capacity = capacity;
    }

    /**
     * Queue a line for delivery.
     *
     * @return false if the recipient already has {@code capacity} lines waiting
     * @throws java.util.concurrent.RejectedExecutionException if the executor is shut down
     */
    boolean offer(String line) {
        synchronized (this) {
            if (pending.size() >= capacity) return false;
            pending.addLast(line);
            if (draining) return true;
            draining = true;
        }
        try {
            executor.execute(this::drain);
        } catch (RuntimeException e) {
            synchronized (this) {
                pending.clear();
                draining = false;
                notifyAll();
            }
            throw e;
        }
        return true;
    }

    private void drain() {
        while (true) {
            String line;
            synchronized (this) {
                if (connection.isClosed()) {
                    pending.clear();
                }
                line = pending.pollFirst();
                if (line == null) {
                    draining = false;
                    notifyAll();
                    return;
                }
            }
            connection.sendLine(line);
        }
    }

    /**
     * Wait until everything offered so far has been written.
     *
     * @return false if the time ran out first
     */
    synchronized boolean awaitIdle(long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (draining || !pending.isEmpty()) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) return false;
            try {
                wait(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }
}
