package com.findly.search.retrieval;

import java.util.Comparator;

public enum RankingMode {
    /**
     * Similarity descending, cheaper first on equal similarity.
     */
    SIMILARITY(Comparator.comparingDouble(CandidateResult::getSimilarity).reversed()
        .thenComparingDouble(CandidateResult::getPrice)
        .thenComparing(CandidateResult::getProductId)),
    /**
     * Price ascending, more similar first on equal price. Used after a price filter matched nothing.
     */
    PRICE_ASCENDING(Comparator.comparingDouble(CandidateResult::getPrice)
        .thenComparing(Comparator.comparingDouble(CandidateResult::getSimilarity).reversed())
        .thenComparing(CandidateResult::getProductId));

    private final Comparator<CandidateResult> comparator;

    RankingMode(Comparator<CandidateResult> comparator) {
        this.comparator = comparator;
    }

    public Comparator<CandidateResult> comparator() {
        return comparator;
    }
}
