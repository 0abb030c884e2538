package com.findly.search.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Memoizes final responses. Every backend failure is absorbed here: callers see a miss on read and a
 * no-op on write, so a dead cache never fails a request.
 */
@Service
public class ResultCacheService {
    private static final Logger logger = LoggerFactory.getLogger(ResultCacheService.class);

    private final ResultCacheProperties properties;
    private final ResultCacheBackend backend;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public ResultCacheService(
        ResultCacheProperties properties,
        ResultCacheBackend backend,
        ObjectMapper objectMapper,
        MeterRegistry meterRegistry
    ) {
        this.properties = properties;
        this.backend = backend;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        if (!properties.isEnabled() || key == null) {
            return Optional.empty();
        }
        try {
            Optional<T> cached = backend.get(key, type);
            meterRegistry.counter(cached.isPresent() ? "search_cache_hit_total" : "search_cache_miss_total").increment();
            return cached;
        } catch (CacheUnavailableException ex) {
            meterRegistry.counter("search_cache_error_total").increment();
            logger.debug("result cache read bypassed backend={} reason={}", backend.name(), ex.getMessage());
            return Optional.empty();
        }
    }

    public void put(String key, Object response, CacheEndpointClass endpointClass) {
        if (!properties.isEnabled() || key == null || response == null) {
            return;
        }
        try {
            backend.put(key, response, properties.ttlFor(endpointClass));
        } catch (CacheUnavailableException ex) {
            meterRegistry.counter("search_cache_error_total").increment();
            logger.debug("result cache write bypassed backend={} reason={}", backend.name(), ex.getMessage());
        }
    }

    /**
     * Key for the AI search class. A pure function of the effective request parameters: the raw
     * query never takes part, only the cleaned text and the resolved bounds.
     */
    public String aiSearchKey(
        String cleanedQuery,
        Double minPrice,
        Double maxPrice,
        int page,
        int limit,
        String targetLanguage
    ) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("q", normalizeText(cleanedQuery));
        fields.put("min_price", formatPrice(minPrice));
        fields.put("max_price", formatPrice(maxPrice));
        fields.put("page", page);
        fields.put("limit", limit);
        fields.put("lang", targetLanguage == null ? null : targetLanguage.toLowerCase(Locale.ROOT));
        return buildKey(CacheEndpointClass.AI_SEARCH, fields);
    }

    public String listingKey(int page, int limit, String sortBy, String sortOrder) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("page", page);
        fields.put("limit", limit);
        fields.put("sort_by", sortBy);
        fields.put("sort_order", sortOrder);
        return buildKey(CacheEndpointClass.LISTING, fields);
    }

    public String autocompleteKey(String query, int limit) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("q", normalizeText(query));
        fields.put("limit", limit);
        return buildKey(CacheEndpointClass.AUTOCOMPLETE, fields);
    }

    public long invalidateAll() {
        try {
            long removed = backend.invalidate(properties.getKeyPrefix());
            logger.info("result cache invalidated backend={} removed={}", backend.name(), removed);
            return removed;
        } catch (CacheUnavailableException ex) {
            logger.warn("result cache invalidation failed backend={} reason={}", backend.name(), ex.getMessage());
            return 0L;
        }
    }

    public CacheStats stats() {
        long entries;
        try {
            entries = backend.count(properties.getKeyPrefix());
        } catch (CacheUnavailableException ex) {
            entries = -1L;
        }
        return new CacheStats(
            properties.isEnabled(),
            backend.name(),
            entries,
            properties.getAiSearchTtl().toSeconds(),
            properties.getListingTtl().toSeconds(),
            properties.getAutocompleteTtl().toSeconds(),
            (long) meterRegistry.counter("search_cache_hit_total").count(),
            (long) meterRegistry.counter("search_cache_miss_total").count()
        );
    }

    private String buildKey(CacheEndpointClass endpointClass, Map<String, Object> fields) {
        String canonical;
        try {
            canonical = objectMapper.writeValueAsString(new TreeMap<>(fields));
        } catch (JsonProcessingException e) {
            logger.warn("result cache key not built endpoint={} reason={}", endpointClass, e.getOriginalMessage());
            return null;
        }
        return properties.getKeyPrefix() + endpointClass.getKeyPrefix() + CacheKeys.sha256Hex(canonical);
    }

    private String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private String formatPrice(Double price) {
        return price == null ? null : String.format(Locale.ROOT, "%.2f", price);
    }

    public static class CacheStats {
        private final boolean enabled;
        private final String backend;
        private final long entries;
        @JsonProperty("ai_search_ttl_seconds")
        private final long aiSearchTtlSeconds;
        @JsonProperty("listing_ttl_seconds")
        private final long listingTtlSeconds;
        @JsonProperty("autocomplete_ttl_seconds")
        private final long autocompleteTtlSeconds;
        private final long hits;
        private final long misses;

        public CacheStats(
            boolean enabled,
            String backend,
            long entries,
            long aiSearchTtlSeconds,
            long listingTtlSeconds,
            long autocompleteTtlSeconds,
            long hits,
            long misses
        ) {
            this.enabled = enabled;
            this.backend = backend;
            this.entries = entries;
            this.aiSearchTtlSeconds = aiSearchTtlSeconds;
            this.listingTtlSeconds = listingTtlSeconds;
            this.autocompleteTtlSeconds = autocompleteTtlSeconds;
            this.hits = hits;
            this.misses = misses;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public String getBackend() {
            return backend;
        }

        public long getEntries() {
            return entries;
        }

        public long getAiSearchTtlSeconds() {
            return aiSearchTtlSeconds;
        }

        public long getListingTtlSeconds() {
            return listingTtlSeconds;
        }

        public long getAutocompleteTtlSeconds() {
            return autocompleteTtlSeconds;
        }

        public long getHits() {
            return hits;
        }

        public long getMisses() {
            return misses;
        }
    }
}
