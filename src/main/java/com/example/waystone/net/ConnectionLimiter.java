package com.example.waystone.net;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps concurrent connections per remote address.
 */
public class ConnectionLimiter {

    private final int maxPerAddress;
    private final Map<String, Integer> counts = new ConcurrentHashMap<>();

    public ConnectionLimiter(int maxPerAddress) {
        this.maxPerAddress = maxPerAddress;
    }

    /**
     * Reserve a slot for the address.
     *
     * @return false if the address is already at its cap
     */
    public boolean tryAcquire(String address) {
        AtomicBoolean granted = new AtomicBoolean(false);
        counts.compute(address, (k, current) -> {
            int n = current == null ? 0 : current;
            if (n >= maxPerAddress) return current;
            granted.set(true);
            return n + 1;
        });
        return granted.get();
    }

    public void release(String address) {
        counts.computeIfPresent(address, (k, current) -> current <= 1 ? null : current - 1);
    }

    public int getCount(String address) {
        return counts.getOrDefault(address, 0);
    }

    public int getMaxPerAddress() {
        return maxPerAddress;
    }
}
