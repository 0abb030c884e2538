package com.findly.search.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(ResultCacheProperties.class)
public class ResultCacheConfig {
    private static final Logger log = LoggerFactory.getLogger(ResultCacheConfig.class);

    @Bean
    public ResultCacheBackend resultCacheBackend(
        ResultCacheProperties properties,
        ObjectProvider<StringRedisTemplate> redisProvider,
        ObjectMapper objectMapper
    ) {
        if (properties.getBackend() == ResultCacheProperties.Backend.REDIS) {
            StringRedisTemplate redis = redisProvider.getIfAvailable();
            if (redis != null) {
                log.info("result cache backend=redis prefix={}", properties.getKeyPrefix());
                return new RedisResultCacheBackend(redis, objectMapper);
            }
            log.warn("result cache backend=redis requested but no redis template available, using memory");
        }
        log.info("result cache backend=memory max_entries={}", properties.getMaxEntries());
        return new InMemoryResultCacheBackend(properties.getMaxEntries());
    }
}
