package com.findly.search.analytics;

import com.findly.search.price.PriceIntentExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget search outcome recording. {@link #record} returns immediately; a full queue or a
 * failing sink drops the event with a warning.
 */
@Component
public class AnalyticsRecorder {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsRecorder.class);

    private final ExecutorService analyticsExecutor;
    private final MeterRegistry meterRegistry;

    public AnalyticsRecorder(@Qualifier("analyticsExecutor") ExecutorService analyticsExecutor, MeterRegistry meterRegistry) {
        this.analyticsExecutor = analyticsExecutor;
        this.meterRegistry = meterRegistry;
    }

    public void record(SearchAnalyticsEvent event) {
        if (event == null) {
            return;
        }
        try {
            analyticsExecutor.execute(() -> write(event));
        } catch (RejectedExecutionException ex) {
            meterRegistry.counter("search_analytics_dropped_total").increment();
            log.warn("analytics event dropped reason=queue_full request_id={}", event.getRequestId());
        }
    }

    void write(SearchAnalyticsEvent event) {
        try {
            meterRegistry.counter(
                "search_requests_total",
                "cache_hit", String.valueOf(event.isCacheHit()),
                "fallback_used", String.valueOf(event.isFallbackUsed())
            ).increment();
            Timer.builder("search_latency")
                .tag("cache_hit", String.valueOf(event.isCacheHit()))
                .register(meterRegistry)
                .record(Duration.ofMillis(event.getLatencyMs()));
            log.info(
                "search analytics request_id={} query={} min_price={} max_price={} price_source={} results={} total={} latency_ms={} cache_hit={} fallback_used={} strategies={}",
                event.getRequestId(),
                PriceIntentExtractor.truncate(event.getQuery()),
                event.getMinPrice(),
                event.getMaxPrice(),
                event.getPriceSource(),
                event.getResultCount(),
                event.getTotalCount(),
                event.getLatencyMs(),
                event.isCacheHit(),
                event.isFallbackUsed(),
                event.getAppliedStrategies()
            );
        } catch (RuntimeException ex) {
            meterRegistry.counter("search_analytics_dropped_total").increment();
            log.warn("analytics event dropped reason=sink_error request_id={}", event.getRequestId(), ex);
        }
    }
}
