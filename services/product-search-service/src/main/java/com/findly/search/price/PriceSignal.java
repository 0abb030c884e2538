package com.findly.search.price;

import java.util.Collections;
import java.util.List;

/**
 * One candidate constraint produced by a single extraction strategy, before signals are merged.
 */
public class PriceSignal {
    private final Double minPrice;
    private final Double maxPrice;
    private final double confidence;
    private final PriceIntentSource source;
    private final List<PriceMatch> matches;

    public PriceSignal(Double minPrice, Double maxPrice, double confidence, PriceIntentSource source, List<PriceMatch> matches) {
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.confidence = confidence;
        this.source = source;
        this.matches = matches == null ? Collections.emptyList() : List.copyOf(matches);
    }

    public Double getMinPrice() {
        return minPrice;
    }

    public Double getMaxPrice() {
        return maxPrice;
    }

    public double getConfidence() {
        return confidence;
    }

    public PriceIntentSource getSource() {
        return source;
    }

    public List<PriceMatch> getMatches() {
        return matches;
    }
}
