package com.findly.search.adaptive;

import com.findly.search.retrieval.PriceRange;
import com.findly.search.retrieval.RetrievalResult;

/**
 * Re-runs retrieval for the same page with a rewritten query text and price range.
 */
@FunctionalInterface
public interface AdaptiveRequery {
    RetrievalResult search(String queryText, PriceRange range);
}
