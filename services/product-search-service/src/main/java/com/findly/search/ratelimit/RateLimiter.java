package com.findly.search.ratelimit;

/**
 * Fixed-window admission per key.
 */
public interface RateLimiter {
    /**
     * @return true when the call fits within {@code limit} for the current window of {@code windowSeconds}
     */
    boolean tryAcquire(String key, int limit, int windowSeconds);

    String backendName();
}
