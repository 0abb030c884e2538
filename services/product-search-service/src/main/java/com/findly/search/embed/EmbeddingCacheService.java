package com.findly.search.embed;

import com.findly.search.cache.CacheKeys;
import com.findly.search.cache.TtlCache;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;

/**
 * Query vectors kept in process, keyed by embedding mode, model and normalized text. Texts longer
 * than {@code embedding.cache.max-text-length} are never cached.
 */
@Service
public class EmbeddingCacheService {
    private final EmbeddingProperties properties;
    private final MeterRegistry meterRegistry;
    private final TtlCache<List<Double>> vectors;

    public EmbeddingCacheService(EmbeddingProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.vectors = new TtlCache<>(properties.getCache().getMaxEntries());
    }

    public List<Double> getOrCompute(String text, Supplier<List<Double>> loader) {
        String key = keyFor(text);
        if (key == null) {
            return loader.get();
        }
        Optional<List<Double>> cached = vectors.get(key);
        if (cached.isPresent()) {
            meterRegistry.counter("search_embedding_cache_hit_total").increment();
            return cached.get();
        }
        meterRegistry.counter("search_embedding_cache_miss_total").increment();
        List<Double> vector = loader.get();
        if (vector != null && !vector.isEmpty()) {
            vectors.put(key, List.copyOf(vector), properties.getCache().getTtlMs());
        }
        return vector;
    }

    public boolean isEnabled() {
        return properties.getCache().isEnabled();
    }

    public int size() {
        return vectors.size();
    }

    String keyFor(String text) {
        if (!isEnabled() || text == null) {
            return null;
        }
        String normalized = text.trim().replaceAll("\\s+", " ");
        if (properties.getCache().isNormalize()) {
            normalized = normalized.toLowerCase(Locale.ROOT);
        }
        int maxLength = properties.getCache().getMaxTextLength();
        if (normalized.isEmpty() || (maxLength > 0 && normalized.length() > maxLength)) {
            return null;
        }
        String model = properties.getModel() == null ? "" : properties.getModel();
        return properties.getMode().name().toLowerCase(Locale.ROOT) + ":" + model + ":" + CacheKeys.sha256Hex(normalized);
    }
}
