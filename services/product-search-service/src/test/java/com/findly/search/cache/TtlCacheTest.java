package com.findly.search.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class TtlCacheTest {

    @Test
    void entriesExpireAfterTtl() {
        AtomicLong now = new AtomicLong(1_000L);
        TtlCache<String> cache = new TtlCache<>(10, now::get);

        cache.put("k", "v", 500L);
        now.set(1_500L);
        assertThat(cache.get("k")).contains("v");

        now.set(1_501L);
        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void oldestEntriesAreEvictedFirst() {
        TtlCache<String> cache = new TtlCache<>(2, () -> 0L);

        cache.put("a", "1", 1_000L);
        cache.put("b", "2", 1_000L);
        cache.put("c", "3", 1_000L);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).isPresent();
        assertThat(cache.get("c")).isPresent();
    }

    @Test
    void ignoresNullsAndNonPositiveTtl() {
        TtlCache<String> cache = new TtlCache<>(5, () -> 0L);

        cache.put(null, "v", 100L);
        cache.put("k", null, 100L);
        cache.put("k", "v", 0L);

        assertThat(cache.size()).isZero();
        assertThat(cache.get(null)).isEmpty();
    }
}
