package com.findly.search.price;

import java.util.Collections;
import java.util.List;

/**
 * The merged price constraint for a query. Both bounds may be null; when both are set
 * {@code minPrice <= maxPrice} always holds.
 */
public class PriceIntent {
    private static final PriceIntent EMPTY = new PriceIntent(null, null, 0.0, null, List.of(), false);

    private final Double minPrice;
    private final Double maxPrice;
    private final double confidence;
    private final PriceIntentSource source;
    private final List<PriceMatch> matches;
    private final boolean conflictResolved;

    public PriceIntent(
        Double minPrice,
        Double maxPrice,
        double confidence,
        PriceIntentSource source,
        List<PriceMatch> matches,
        boolean conflictResolved
    ) {
        if (minPrice != null && maxPrice != null && minPrice > maxPrice) {
            throw new IllegalArgumentException("min_price " + minPrice + " exceeds max_price " + maxPrice);
        }
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.confidence = confidence;
        this.source = source;
        this.matches = matches == null ? Collections.emptyList() : List.copyOf(matches);
        this.conflictResolved = conflictResolved;
    }

    public static PriceIntent empty() {
        return EMPTY;
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

    /**
     * Spans of the raw query that the winning signals matched; what the normalizer strips.
     */
    public List<PriceMatch> getMatches() {
        return matches;
    }

    public boolean isConflictResolved() {
        return conflictResolved;
    }

    public boolean hasFilter() {
        return minPrice != null || maxPrice != null;
    }

    @Override
    public String toString() {
        return "PriceIntent{min=" + minPrice + ", max=" + maxPrice + ", confidence=" + confidence
            + ", source=" + (source == null ? null : source.getWireName()) + "}";
    }
}
