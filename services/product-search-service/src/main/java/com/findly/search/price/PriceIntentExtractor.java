package com.findly.search.price;

import com.findly.search.config.CategoryPriceBand;
import com.findly.search.config.SearchConfigService;
import com.findly.search.config.SearchConfigSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns free text into a {@link PriceIntent}. Deterministic strategies (patterns, then budget and
 * premium keywords) always run; the LLM is consulted only below the confidence threshold and only
 * when the query contains digits or price vocabulary. Never throws for any input.
 */
@Service
public class PriceIntentExtractor {
    private static final Logger log = LoggerFactory.getLogger(PriceIntentExtractor.class);
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern PRICE_VOCABULARY = Pattern.compile(
        "(?:(?<!\\w)€|\\b(?:euro|eur|prijs|prijzen|prijsklasse|kost|kosten|price|prices|priced|cost|costs)\\b)",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    private final List<PriceSignalStrategy> strategies;
    private final LlmPriceStrategy llmStrategy;
    private final SearchConfigService configService;
    private final PriceIntentProperties properties;
    private final Counter conflictCounter;

    public PriceIntentExtractor(
        PatternPriceStrategy patternStrategy,
        KeywordPriceStrategy keywordStrategy,
        LlmPriceStrategy llmStrategy,
        SearchConfigService configService,
        PriceIntentProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.strategies = List.of(patternStrategy, keywordStrategy);
        this.llmStrategy = llmStrategy;
        this.configService = configService;
        this.properties = properties;
        this.conflictCounter = meterRegistry.counter("search_price_conflict_total");
    }

    public PriceIntent extract(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return PriceIntent.empty();
        }
        try {
            return doExtract(rawQuery);
        } catch (RuntimeException ex) {
            log.warn("price intent extraction failed query={}", truncate(rawQuery), ex);
            return PriceIntent.empty();
        }
    }

    private PriceIntent doExtract(String rawQuery) {
        SearchConfigSnapshot config = configService.current();
        List<PriceSignal> signals = new ArrayList<>();
        for (PriceSignalStrategy strategy : strategies) {
            signals.addAll(strategy.detect(rawQuery, config));
        }
        PriceIntent intent = merge(signals, rawQuery);
        if (intent.getConfidence() >= properties.getConfidenceThreshold()) {
            return logged(intent, rawQuery);
        }

        boolean numeric = DIGIT.matcher(rawQuery).find();
        boolean priceVocabulary = PRICE_VOCABULARY.matcher(rawQuery).find();
        if (!numeric && !priceVocabulary) {
            return intent;
        }

        Optional<PriceSignal> inferred = llmStrategy.infer(rawQuery, config);
        if (inferred.isPresent()) {
            signals.add(inferred.get());
            intent = merge(signals, rawQuery);
        }

        if (!intent.hasFilter() && priceVocabulary && properties.isStoreFallbackEnabled()) {
            CategoryPriceBand store = config.getStoreStatistics();
            intent = new PriceIntent(
                Math.min(store.getBudgetMax(), store.getPremiumMin()),
                Math.max(store.getBudgetMax(), store.getPremiumMin()),
                properties.getStoreFallbackConfidence(),
                PriceIntentSource.STORE_STATISTICAL_FALLBACK,
                List.of(),
                false
            );
        }
        return logged(intent, rawQuery);
    }

    /**
     * Picks each bound from the most confident signal that sets it; ties go to the signal listed
     * first, which puts patterns ahead of keywords and keywords ahead of the LLM. When the chosen
     * bounds cross, the less confident side is dropped (the lower bound on a tie).
     */
    PriceIntent merge(List<PriceSignal> signals, String rawQuery) {
        PriceSignal minSignal = null;
        PriceSignal maxSignal = null;
        for (PriceSignal signal : signals) {
            if (signal.getMinPrice() != null && (minSignal == null || signal.getConfidence() > minSignal.getConfidence())) {
                minSignal = signal;
            }
            if (signal.getMaxPrice() != null && (maxSignal == null || signal.getConfidence() > maxSignal.getConfidence())) {
                maxSignal = signal;
            }
        }
        boolean conflict = false;
        if (minSignal != null && maxSignal != null && minSignal.getMinPrice() > maxSignal.getMaxPrice()) {
            conflict = true;
            PriceSignal discarded;
            if (minSignal.getConfidence() > maxSignal.getConfidence()) {
                discarded = maxSignal;
                maxSignal = null;
            } else {
                discarded = minSignal;
                minSignal = null;
            }
            conflictCounter.increment();
            log.warn(
                "price signal conflict discarded_source={} discarded_confidence={} query={}",
                discarded.getSource().getWireName(),
                discarded.getConfidence(),
                truncate(rawQuery)
            );
        }

        List<PriceSignal> winners = new ArrayList<>();
        if (minSignal != null) {
            winners.add(minSignal);
        }
        if (maxSignal != null && maxSignal != minSignal) {
            winners.add(maxSignal);
        }
        if (winners.isEmpty()) {
            return PriceIntent.empty();
        }
        PriceSignal strongest = winners.get(0);
        List<PriceMatch> matches = new ArrayList<>();
        for (PriceSignal winner : winners) {
            if (winner.getConfidence() > strongest.getConfidence()) {
                strongest = winner;
            }
            matches.addAll(winner.getMatches());
        }
        matches.sort(Comparator.comparingInt(PriceMatch::getStart));
        return new PriceIntent(
            minSignal == null ? null : minSignal.getMinPrice(),
            maxSignal == null ? null : maxSignal.getMaxPrice(),
            strongest.getConfidence(),
            strongest.getSource(),
            matches,
            conflict
        );
    }

    private PriceIntent logged(PriceIntent intent, String rawQuery) {
        if (intent.hasFilter()) {
            log.info(
                "price intent detected min={} max={} source={} confidence={} query={}",
                intent.getMinPrice(),
                intent.getMaxPrice(),
                intent.getSource().getWireName(),
                intent.getConfidence(),
                truncate(rawQuery)
            );
        }
        return intent;
    }

    public static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}
