package com.findly.search.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {

    @Test
    void opensAfterConsecutiveFailuresAndRecovers() {
        AtomicLong now = new AtomicLong(10_000L);
        CircuitBreaker breaker = new CircuitBreaker("store", 3, 1_000L, now::get);

        breaker.recordFailure();
        breaker.recordFailure();
        assertThat(breaker.allowRequest()).isTrue();

        breaker.recordFailure();
        assertThat(breaker.isOpen()).isTrue();

        now.addAndGet(999L);
        assertThat(breaker.allowRequest()).isFalse();

        now.addAndGet(1L);
        assertThat(breaker.allowRequest()).isTrue();
    }

    @Test
    void successResetsTheFailureRun() {
        AtomicLong now = new AtomicLong(0L);
        CircuitBreaker breaker = new CircuitBreaker("embedding", 2, 500L, now::get);

        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertThat(breaker.allowRequest()).isTrue();
    }
}
