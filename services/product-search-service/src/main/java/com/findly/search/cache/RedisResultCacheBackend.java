package com.findly.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

public class RedisResultCacheBackend implements ResultCacheBackend {
    private static final int SCAN_BATCH = 500;

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    public RedisResultCacheBackend(StringRedisTemplate redis, ObjectMapper objectMapper) {
        this.redis = redis;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String payload;
        try {
            payload = redis.opsForValue().get(key);
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("redis read failed", ex);
        }
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(payload, type));
        } catch (JsonProcessingException ex) {
            throw new CacheUnavailableException("cached payload unreadable", ex);
        }
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new CacheUnavailableException("payload not serializable", ex);
        }
        try {
            redis.opsForValue().set(key, payload, ttl);
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("redis write failed", ex);
        }
    }

    @Override
    public long invalidate(String keyPrefix) {
        try {
            List<String> keys = scan(keyPrefix);
            if (keys.isEmpty()) {
                return 0L;
            }
            Long deleted = redis.delete(keys);
            return deleted == null ? 0L : deleted;
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("redis invalidation failed", ex);
        }
    }

    @Override
    public long count(String keyPrefix) {
        try {
            return scan(keyPrefix).size();
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("redis scan failed", ex);
        }
    }

    private List<String> scan(String keyPrefix) {
        ScanOptions options = ScanOptions.scanOptions().match(keyPrefix + "*").count(SCAN_BATCH).build();
        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = redis.scan(options)) {
            cursor.forEachRemaining(keys::add);
        }
        return keys;
    }
}
