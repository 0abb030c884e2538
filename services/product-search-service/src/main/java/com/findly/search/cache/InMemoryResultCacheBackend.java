package com.findly.search.cache;

import java.time.Duration;
import java.util.Optional;

public class InMemoryResultCacheBackend implements ResultCacheBackend {
    private final TtlCache<Object> cache;

    public InMemoryResultCacheBackend(int maxEntries) {
        this.cache = new TtlCache<>(maxEntries);
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return cache.get(key)
            .filter(type::isInstance)
            .map(type::cast);
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        cache.put(key, value, ttl.toMillis());
    }

    @Override
    public long invalidate(String keyPrefix) {
        int size = cache.size();
        cache.clear();
        return size;
    }

    @Override
    public long count(String keyPrefix) {
        return cache.size();
    }
}
