package com.findly.search.adaptive;

import com.findly.search.config.CategoryPriceBand;
import com.findly.search.config.SearchConfigService;
import com.findly.search.config.SearchConfigSnapshot;
import com.findly.search.retrieval.CandidateResult;
import com.findly.search.retrieval.PriceRange;
import com.findly.search.retrieval.RetrievalResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Broadens or reorders a non-empty but weak result set using the configured strategy catalog.
 * Strategies run in catalog order until the quality signals clear, {@code max-strategies} have been
 * attempted, or the terminal emergency strategy has run.
 */
@Service
public class AdaptiveFilterEngine {
    private static final Logger logger = LoggerFactory.getLogger(AdaptiveFilterEngine.class);

    private final AdaptiveFilterProperties properties;
    private final QualityEvaluator evaluator;
    private final SearchConfigService configService;
    private final MeterRegistry meterRegistry;

    public AdaptiveFilterEngine(
        AdaptiveFilterProperties properties,
        QualityEvaluator evaluator,
        SearchConfigService configService,
        MeterRegistry meterRegistry
    ) {
        this.properties = properties;
        this.evaluator = evaluator;
        this.configService = configService;
        this.meterRegistry = meterRegistry;
    }

    public AdaptiveOutcome apply(AdaptiveContext context, AdaptiveRequery requery) {
        SearchConfigSnapshot config = configService.current();
        boolean categoryRequested = config.detectCategory(context.getCleanedQuery()).isPresent();
        QualitySignals initial = evaluator.evaluate(context.getInitialResult(), context.getOriginalRange(), categoryRequested);
        if (!properties.isEnabled() || context.getInitialResult().isEmpty() || initial.isAcceptable()) {
            return AdaptiveOutcome.unchanged(context, initial);
        }

        State state = new State(context.getCleanedQuery(), context.getOriginalRange(), context.getInitialResult());
        QualitySignals signals = initial;
        List<String> applied = new ArrayList<>();
        int attempts = 0;
        for (FilterStrategy strategy : config.getStrategies()) {
            if (attempts >= Math.max(1, properties.getMaxStrategies())) {
                break;
            }
            if (!strategy.isEnabled() || !isApplicable(strategy, signals, context)) {
                continue;
            }
            State next = transform(strategy, context, state, config, requery);
            if (next == null) {
                continue;
            }
            attempts++;
            if (next.result.isEmpty()) {
                logger.debug("adaptive strategy produced no results strategy={}", strategy.getName());
            } else if (raisesIncoherence(next, signals, context, categoryRequested)) {
                logger.debug("adaptive strategy rejected, price incoherent strategy={} range={}", strategy.getName(), next.range);
            } else {
                state = next;
                applied.add(strategy.getName());
                meterRegistry.counter("search_adaptive_strategy_total", "strategy", strategy.getName()).increment();
            }
            if (strategy.getAction().isTerminal()) {
                break;
            }
            signals = evaluator.evaluate(state.result, context.getOriginalRange(), categoryRequested);
            if (signals.isAcceptable()) {
                break;
            }
        }

        QualitySignals finalSignals = evaluator.evaluate(state.result, context.getOriginalRange(), categoryRequested);
        if (!applied.isEmpty()) {
            logger.info(
                "adaptive strategies applied strategies={} before=[{}] after=[{}]",
                applied,
                initial,
                finalSignals
            );
        }
        return new AdaptiveOutcome(state.result, applied, state.range, state.query, initial, finalSignals);
    }

    /**
     * A strategy may not turn a price-coherent page into an incoherent one; the intent is judged against
     * the original bounds, not the broadened ones.
     */
    private boolean raisesIncoherence(State next, QualitySignals current, AdaptiveContext context, boolean categoryRequested) {
        if (current.isPriceIncoherent() || !context.getOriginalRange().isBounded()) {
            return false;
        }
        return evaluator.evaluate(next.result, context.getOriginalRange(), categoryRequested).isPriceIncoherent();
    }

    boolean isApplicable(FilterStrategy strategy, QualitySignals signals, AdaptiveContext context) {
        PriceRange original = context.getOriginalRange();
        return switch (strategy.getAction()) {
            case PRICE_BROADEN_LOW -> original.getMin() != null && signals.isLowCount();
            case PRICE_BROADEN_HIGH -> original.getMax() != null && signals.isLowCount();
            case CATEGORY_BROADEN -> signals.isLowCount() || signals.isLowDiversity();
            case DIVERSITY_IMPROVE -> signals.isLowDiversity();
            case MATERIAL_FALLBACK, COLOR_FALLBACK -> signals.isLowCount();
            case EMERGENCY_FALLBACK -> true;
        };
    }

    /**
     * Returns the state after applying the strategy, or null when it would change nothing. Targets are
     * computed from the original query and bounds, so a repeated application is a no-op.
     */
    State transform(
        FilterStrategy strategy,
        AdaptiveContext context,
        State state,
        SearchConfigSnapshot config,
        AdaptiveRequery requery
    ) {
        PriceRange original = context.getOriginalRange();
        switch (strategy.getAction()) {
            case PRICE_BROADEN_LOW: {
                if (original.getMin() == null || state.range.getMin() == null) {
                    return null;
                }
                double target = original.getMin() * strategy.doubleParam("factor", 1.0 - properties.getPriceTolerance());
                if (state.range.getMin() <= target) {
                    return null;
                }
                PriceRange range = state.range.withMin(target);
                return new State(state.query, range, requery.search(state.query, range));
            }
            case PRICE_BROADEN_HIGH: {
                if (original.getMax() == null || state.range.getMax() == null) {
                    return null;
                }
                double target = original.getMax() * strategy.doubleParam("factor", 1.0 + properties.getPriceTolerance());
                if (state.range.getMax() >= target) {
                    return null;
                }
                PriceRange range = state.range.withMax(target);
                return new State(state.query, range, requery.search(state.query, range));
            }
            case CATEGORY_BROADEN: {
                Optional<CategoryPriceBand> category = config.detectCategory(context.getCleanedQuery());
                if (category.isEmpty()) {
                    return null;
                }
                Set<String> present = new HashSet<>(SearchConfigSnapshot.tokenize(state.query));
                List<String> additions = new ArrayList<>();
                for (String related : config.relatedTo(category.get().getCategory())) {
                    if (additions.size() >= strategy.intParam("max_related", 2)) {
                        break;
                    }
                    if (!present.contains(related.toLowerCase(Locale.ROOT))) {
                        additions.add(related);
                    }
                }
                if (additions.isEmpty()) {
                    return null;
                }
                String query = state.query + " " + String.join(" ", additions);
                return new State(query, state.range, requery.search(query, state.range));
            }
            case DIVERSITY_IMPROVE: {
                List<CandidateResult> reordered = limitPerCategory(state.result.getCandidates(), strategy.intParam("max_similar", 3));
                if (reordered.equals(state.result.getCandidates())) {
                    return null;
                }
                return new State(state.query, state.range, new RetrievalResult(reordered, state.result.getTotalCount()));
            }
            case MATERIAL_FALLBACK:
                return stripTerms(config.getMaterials(), state, requery);
            case COLOR_FALLBACK:
                return stripTerms(config.getColors(), state, requery);
            case EMERGENCY_FALLBACK: {
                // With a stated budget only the query text is relaxed; the current range stays.
                PriceRange range = original.isBounded() ? state.range : PriceRange.unbounded();
                if (state.range.equals(range) && state.query.equals(context.getCleanedQuery())) {
                    return null;
                }
                return new State(context.getCleanedQuery(), range, requery.search(context.getCleanedQuery(), range));
            }
            default:
                return null;
        }
    }

    /**
     * Keeps the first {@code maxSimilar} items of each category in place and moves the rest, in their
     * original order, behind them.
     */
    static List<CandidateResult> limitPerCategory(List<CandidateResult> candidates, int maxSimilar) {
        int limit = Math.max(1, maxSimilar);
        Map<String, Integer> seen = new HashMap<>();
        List<CandidateResult> head = new ArrayList<>();
        List<CandidateResult> tail = new ArrayList<>();
        for (CandidateResult candidate : candidates) {
            if (candidate.getCategory() == null) {
                head.add(candidate);
                continue;
            }
            int count = seen.merge(candidate.getCategory(), 1, Integer::sum);
            if (count <= limit) {
                head.add(candidate);
            } else {
                tail.add(candidate);
            }
        }
        head.addAll(tail);
        return head;
    }

    private State stripTerms(List<String> terms, State state, AdaptiveRequery requery) {
        if (terms.isEmpty()) {
            return null;
        }
        Set<String> lowered = new HashSet<>();
        for (String term : terms) {
            lowered.add(term.toLowerCase(Locale.ROOT));
        }
        List<String> kept = new ArrayList<>();
        for (String word : state.query.split("\\s+")) {
            String bare = word.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}-]", "");
            if (!lowered.contains(bare)) {
                kept.add(word);
            }
        }
        String query = String.join(" ", kept).trim();
        if (query.isEmpty() || query.equals(state.query)) {
            return null;
        }
        return new State(query, state.range, requery.search(query, state.range));
    }

    static final class State {
        private final String query;
        private final PriceRange range;
        private final RetrievalResult result;

        State(String query, PriceRange range, RetrievalResult result) {
            this.query = query;
            this.range = range;
            this.result = result;
        }
    }
}
