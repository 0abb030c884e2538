package com.findly.search.embed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class EmbeddingCacheServiceTest {

    @Test
    void cacheHonorsNormalizeFlag() {
        EmbeddingProperties props = new EmbeddingProperties();
        props.getCache().setNormalize(true);
        EmbeddingCacheService service = new EmbeddingCacheService(props, new SimpleMeterRegistry());
        AtomicInteger loads = new AtomicInteger();

        service.getOrCompute("Rode  Sneakers", () -> vector(loads, 0.1));
        service.getOrCompute("rode sneakers", () -> vector(loads, 0.1));
        assertEquals(1, loads.get());

        EmbeddingProperties propsNoNorm = new EmbeddingProperties();
        propsNoNorm.getCache().setNormalize(false);
        EmbeddingCacheService noNormService = new EmbeddingCacheService(propsNoNorm, new SimpleMeterRegistry());
        AtomicInteger noNormLoads = new AtomicInteger();

        noNormService.getOrCompute("Rode Sneakers", () -> vector(noNormLoads, 0.2));
        noNormService.getOrCompute("rode sneakers", () -> vector(noNormLoads, 0.2));
        assertEquals(2, noNormLoads.get());
    }

    @Test
    void countsHitsAndMisses() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        EmbeddingCacheService service = new EmbeddingCacheService(new EmbeddingProperties(), registry);
        AtomicInteger loads = new AtomicInteger();

        List<Double> first = service.getOrCompute("winterjas", () -> vector(loads, 0.4));
        List<Double> second = service.getOrCompute("winterjas", () -> vector(loads, 0.9));

        assertEquals(first, second);
        assertEquals(1.0, registry.counter("search_embedding_cache_hit_total").count());
        assertEquals(1.0, registry.counter("search_embedding_cache_miss_total").count());
    }

    @Test
    void longTextsAreNotCached() {
        EmbeddingProperties props = new EmbeddingProperties();
        props.getCache().setMaxTextLength(10);
        EmbeddingCacheService service = new EmbeddingCacheService(props, new SimpleMeterRegistry());
        AtomicInteger loads = new AtomicInteger();

        service.getOrCompute("winterjas met capuchon", () -> vector(loads, 0.3));
        service.getOrCompute("winterjas met capuchon", () -> vector(loads, 0.3));

        assertEquals(2, loads.get());
        assertNull(service.keyFor("winterjas met capuchon"));
        assertEquals(0, service.size());
    }

    @Test
    void keysAreScopedByModel() {
        EmbeddingProperties props = new EmbeddingProperties();
        props.setModel("model-a");
        EmbeddingCacheService service = new EmbeddingCacheService(props, new SimpleMeterRegistry());
        String first = service.keyFor("jas");

        props.setModel("model-b");
        String second = service.keyFor("jas");

        assertNotEquals(first, second);
    }

    @Test
    void disabledCacheAlwaysLoads() {
        EmbeddingProperties props = new EmbeddingProperties();
        props.getCache().setEnabled(false);
        EmbeddingCacheService service = new EmbeddingCacheService(props, new SimpleMeterRegistry());
        AtomicInteger loads = new AtomicInteger();

        service.getOrCompute("jas", () -> vector(loads, 0.5));
        service.getOrCompute("jas", () -> vector(loads, 0.5));

        assertEquals(2, loads.get());
        assertNull(service.keyFor("jas"));
    }

    private List<Double> vector(AtomicInteger loads, double value) {
        loads.incrementAndGet();
        return List.of(value);
    }
}
