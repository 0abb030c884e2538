package com.findly.search.adaptive;

import com.findly.search.retrieval.PriceRange;
import com.findly.search.retrieval.RetrievalResult;
import java.util.List;

public class AdaptiveOutcome {
    private final RetrievalResult result;
    private final List<String> appliedStrategies;
    private final PriceRange effectiveRange;
    private final String effectiveQuery;
    private final QualitySignals initialSignals;
    private final QualitySignals finalSignals;

    public AdaptiveOutcome(
        RetrievalResult result,
        List<String> appliedStrategies,
        PriceRange effectiveRange,
        String effectiveQuery,
        QualitySignals initialSignals,
        QualitySignals finalSignals
    ) {
        this.result = result;
        this.appliedStrategies = List.copyOf(appliedStrategies);
        this.effectiveRange = effectiveRange;
        this.effectiveQuery = effectiveQuery;
        this.initialSignals = initialSignals;
        this.finalSignals = finalSignals;
    }

    public static AdaptiveOutcome unchanged(AdaptiveContext context, QualitySignals signals) {
        return new AdaptiveOutcome(
            context.getInitialResult(),
            List.of(),
            context.getOriginalRange(),
            context.getCleanedQuery(),
            signals,
            signals
        );
    }

    public RetrievalResult getResult() {
        return result;
    }

    public List<String> getAppliedStrategies() {
        return appliedStrategies;
    }

    public PriceRange getEffectiveRange() {
        return effectiveRange;
    }

    public String getEffectiveQuery() {
        return effectiveQuery;
    }

    public QualitySignals getInitialSignals() {
        return initialSignals;
    }

    public QualitySignals getFinalSignals() {
        return finalSignals;
    }
}
