package com.findly.search.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AnalyticsRecorderTest {

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void writesCountersAndLatency() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AnalyticsRecorder recorder = new AnalyticsRecorder(null, registry);

        recorder.write(event(true, false, 12));
        recorder.write(event(false, true, 250));

        assertThat(registry.get("search_requests_total").tag("cache_hit", "true").tag("fallback_used", "false")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("search_requests_total").tag("cache_hit", "false").tag("fallback_used", "true")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("search_latency").tag("cache_hit", "false").timer().totalTime(TimeUnit.MILLISECONDS))
            .isEqualTo(250.0);
    }

    @Test
    void recordRunsOnTheAnalyticsExecutor() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(4));
        AnalyticsRecorder recorder = new AnalyticsRecorder(executor, registry);

        recorder.record(event(false, false, 30));
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(registry.get("search_requests_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void fullQueueDropsEventsWithoutBlocking() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(1));
        executor = pool;
        CountDownLatch release = new CountDownLatch(1);
        pool.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        pool.execute(() -> { });
        AnalyticsRecorder recorder = new AnalyticsRecorder(pool, registry);

        recorder.record(event(false, false, 5));
        recorder.record(null);
        release.countDown();

        assertThat(registry.get("search_analytics_dropped_total").counter().count()).isEqualTo(1.0);
    }

    private SearchAnalyticsEvent event(boolean cacheHit, boolean fallbackUsed, long latencyMs) {
        return new SearchAnalyticsEvent(
            "req-1",
            "schoenen onder 50 euro",
            null,
            50.0,
            "regex_range",
            10,
            40,
            latencyMs,
            cacheHit,
            fallbackUsed,
            List.of(),
            Instant.parse("2024-06-01T10:00:00Z")
        );
    }
}
