package com.findly.search.analytics;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a finished search. Shares no state with the response it was taken from.
 */
public final class SearchAnalyticsEvent {
    private final String requestId;
    private final String query;
    private final Double minPrice;
    private final Double maxPrice;
    private final String priceSource;
    private final int resultCount;
    private final long totalCount;
    private final long latencyMs;
    private final boolean cacheHit;
    private final boolean fallbackUsed;
    private final List<String> appliedStrategies;
    private final Instant occurredAt;

    public SearchAnalyticsEvent(
        String requestId,
        String query,
        Double minPrice,
        Double maxPrice,
        String priceSource,
        int resultCount,
        long totalCount,
        long latencyMs,
        boolean cacheHit,
        boolean fallbackUsed,
        List<String> appliedStrategies,
        Instant occurredAt
    ) {
        this.requestId = requestId;
        this.query = query;
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.priceSource = priceSource;
        this.resultCount = resultCount;
        this.totalCount = totalCount;
        this.latencyMs = latencyMs;
        this.cacheHit = cacheHit;
        this.fallbackUsed = fallbackUsed;
        this.appliedStrategies = appliedStrategies == null ? List.of() : List.copyOf(appliedStrategies);
        this.occurredAt = occurredAt;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getQuery() {
        return query;
    }

    public Double getMinPrice() {
        return minPrice;
    }

    public Double getMaxPrice() {
        return maxPrice;
    }

    public String getPriceSource() {
        return priceSource;
    }

    public int getResultCount() {
        return resultCount;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public boolean isCacheHit() {
        return cacheHit;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    public List<String> getAppliedStrategies() {
        return appliedStrategies;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
