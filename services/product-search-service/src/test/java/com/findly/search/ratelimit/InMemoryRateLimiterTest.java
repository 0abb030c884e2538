package com.findly.search.ratelimit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class InMemoryRateLimiterTest {

    @Test
    void allowsUpToLimitWithinWindow() {
        AtomicLong now = new AtomicLong(120_000L);
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(now::get);

        assertTrue(limiter.tryAcquire("ip:1", 2, 60));
        assertTrue(limiter.tryAcquire("ip:1", 2, 60));
        assertFalse(limiter.tryAcquire("ip:1", 2, 60));
        assertTrue(limiter.tryAcquire("ip:2", 2, 60));
    }

    @Test
    void resetsInNextWindow() {
        AtomicLong now = new AtomicLong(120_000L);
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(now::get);

        assertTrue(limiter.tryAcquire("ip:1", 1, 60));
        assertFalse(limiter.tryAcquire("ip:1", 1, 60));

        now.addAndGet(60_000L);
        assertTrue(limiter.tryAcquire("ip:1", 1, 60));
    }
}
