package com.findly.search.ratelimit;

import java.time.Duration;
import java.util.function.LongSupplier;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Fixed-window counter shared by all instances through Redis {@code INCR}. The first hit of a window
 * sets the expiry so stale windows disappear on their own.
 */
public class RedisRateLimiter implements RateLimiter {
    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final LongSupplier clock;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, String keyPrefix) {
        this(redisTemplate, keyPrefix, System::currentTimeMillis);
    }

    RedisRateLimiter(StringRedisTemplate redisTemplate, String keyPrefix, LongSupplier clock) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String key, int limit, int windowSeconds) {
        int window = Math.max(windowSeconds, 1);
        String windowKey = keyPrefix + "rate:" + key + ":" + clock.getAsLong() / 1000L / window;
        Long hits = redisTemplate.opsForValue().increment(windowKey);
        if (hits == null) {
            return true;
        }
        if (hits == 1L) {
            redisTemplate.expire(windowKey, Duration.ofSeconds(window));
        }
        return hits <= limit;
    }

    @Override
    public String backendName() {
        return "redis";
    }
}
