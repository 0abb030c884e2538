package com.findly.search.price;

import com.findly.search.config.SearchConfigSnapshot;
import java.util.List;

/**
 * A deterministic extraction step. Implementations are pure functions of the query and the current
 * configuration snapshot.
 */
public interface PriceSignalStrategy {
    String name();

    List<PriceSignal> detect(String rawQuery, SearchConfigSnapshot config);
}
