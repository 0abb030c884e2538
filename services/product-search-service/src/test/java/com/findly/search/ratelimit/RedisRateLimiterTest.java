package com.findly.search.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisRateLimiterTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisRateLimiter limiter;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        limiter = new RedisRateLimiter(redisTemplate, "findly:", () -> 125_000L);
    }

    @Test
    void firstHitOfWindowSetsExpiry() {
        when(valueOperations.increment("findly:rate:ai_search:ip:1:2")).thenReturn(1L);

        assertThat(limiter.tryAcquire("ai_search:ip:1", 5, 60)).isTrue();
        verify(redisTemplate).expire("findly:rate:ai_search:ip:1:2", Duration.ofSeconds(60));
    }

    @Test
    void rejectsOverLimitWithoutTouchingExpiry() {
        when(valueOperations.increment(anyString())).thenReturn(6L);

        assertThat(limiter.tryAcquire("ai_search:ip:1", 5, 60)).isFalse();
        verify(redisTemplate, never()).expire(anyString(), eq(Duration.ofSeconds(60)));
    }
}
