package com.findly.search.adaptive;

import com.findly.search.retrieval.PriceRange;
import com.findly.search.retrieval.RetrievalResult;

/**
 * Inputs of one adaptive run. The original query and bounds stay fixed for the whole run; every
 * strategy derives its target from them, never from an earlier strategy's output.
 */
public class AdaptiveContext {
    private final String cleanedQuery;
    private final PriceRange originalRange;
    private final RetrievalResult initialResult;

    public AdaptiveContext(String cleanedQuery, PriceRange originalRange, RetrievalResult initialResult) {
        this.cleanedQuery = cleanedQuery;
        this.originalRange = originalRange == null ? PriceRange.unbounded() : originalRange;
        this.initialResult = initialResult;
    }

    public String getCleanedQuery() {
        return cleanedQuery;
    }

    public PriceRange getOriginalRange() {
        return originalRange;
    }

    public RetrievalResult getInitialResult() {
        return initialResult;
    }
}
