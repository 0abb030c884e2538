package com.findly.search.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Storage behind {@link ResultCacheService}. Implementations signal an unreachable store with
 * {@link CacheUnavailableException}; they never decide whether the request should fail.
 */
public interface ResultCacheBackend {
    String name();

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value, Duration ttl);

    long invalidate(String keyPrefix);

    /**
     * Number of live entries under the prefix, or -1 when the backend cannot count cheaply.
     */
    long count(String keyPrefix);
}
