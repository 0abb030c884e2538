package com.findly.search.fallback;

import com.findly.search.query.TargetLanguage;
import com.findly.search.retrieval.RetrievalResult;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a price-filtered result is acceptable. An empty filtered result triggers exactly
 * one unfiltered, cheapest-first re-query; its outcome is final even when it is empty too.
 */
@Component
public class FallbackResolver {
    private static final Logger logger = LoggerFactory.getLogger(FallbackResolver.class);

    static final String MESSAGE_NL = "Geen producten gevonden binnen de prijsklasse, hier zijn de goedkoopste alternatieven.";
    static final String MESSAGE_EN = "No products found in the requested price range, here are the cheapest alternatives.";

    public FallbackOutcome resolve(
        RetrievalResult filtered,
        boolean priceFilterApplied,
        Supplier<RetrievalResult> cheapestUnfiltered,
        TargetLanguage language
    ) {
        Run run = new Run();
        if (!filtered.isEmpty() || !priceFilterApplied) {
            run.moveTo(FallbackState.DONE);
            return new FallbackOutcome(filtered, false, null, 0, run.path);
        }

        run.moveTo(FallbackState.FALLBACK);
        RetrievalResult alternatives = cheapestUnfiltered.get();
        run.moveTo(FallbackState.DONE);
        logger.info("price fallback used results={} total={}", alternatives.getCandidates().size(), alternatives.getTotalCount());
        return new FallbackOutcome(alternatives, true, message(language), 1, run.path);
    }

    public static String message(TargetLanguage language) {
        return language == TargetLanguage.EN ? MESSAGE_EN : MESSAGE_NL;
    }

    private static final class Run {
        private FallbackState state = FallbackState.FILTERED;
        private final List<FallbackState> path = new ArrayList<>(List.of(FallbackState.FILTERED));

        private void moveTo(FallbackState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("illegal fallback transition " + state + " -> " + next);
            }
            state = next;
            path.add(next);
        }
    }
}
