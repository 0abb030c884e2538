package com.findly.search.ratelimit;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.LongSupplier;

/**
 * Fixed-window counter per key, local to this instance.
 */
public class InMemoryRateLimiter implements RateLimiter {
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final LongSupplier clock;

    public InMemoryRateLimiter() {
        this(System::currentTimeMillis);
    }

    public InMemoryRateLimiter(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String key, int limit, int windowSeconds) {
        long windowId = clock.getAsLong() / 1000L / Math.max(windowSeconds, 1);
        Window window = windows.computeIfAbsent(key, k -> new Window(windowId));
        synchronized (window) {
            if (window.id != windowId) {
                window.id = windowId;
                window.count = 0;
            }
            window.count += 1;
            return window.count <= limit;
        }
    }

    @Override
    public String backendName() {
        return "memory";
    }

    private static class Window {
        private long id;
        private int count;

        private Window(long id) {
            this.id = id;
        }
    }
}
