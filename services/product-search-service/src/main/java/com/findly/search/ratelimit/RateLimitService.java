package com.findly.search.ratelimit;

import com.findly.search.cache.ResultCacheProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

@Service
public class RateLimitService {
    private static final Logger log = LoggerFactory.getLogger(RateLimitService.class);

    private final RateLimiter rateLimiter;
    private final RateLimiter localLimiter = new InMemoryRateLimiter();
    private final RateLimitProperties properties;

    public RateLimitService(
        ObjectProvider<StringRedisTemplate> redisTemplate,
        RateLimitProperties properties,
        ResultCacheProperties cacheProperties
    ) {
        this.properties = properties;
        StringRedisTemplate template = "redis".equalsIgnoreCase(properties.getBackend()) ? redisTemplate.getIfAvailable() : null;
        this.rateLimiter = template != null
            ? new RedisRateLimiter(template, cacheProperties.getKeyPrefix())
            : localLimiter;
        log.info(
            "rate limiter ready backend={} window_seconds={} ai_search_per_window={}",
            rateLimiter.backendName(),
            properties.getWindowSeconds(),
            properties.getAiSearchPerWindow()
        );
    }

    public boolean allow(String key, int limit) {
        try {
            return rateLimiter.tryAcquire(key, limit, properties.getWindowSeconds());
        } catch (DataAccessException ex) {
            log.debug("rate limit backend unavailable, using local window: {}", ex.getMessage());
            return localLimiter.tryAcquire(key, limit, properties.getWindowSeconds());
        }
    }

    public RateLimitProperties getProperties() {
        return properties;
    }
}
