package com.findly.search.price;

import com.findly.search.config.CategoryPriceBand;
import com.findly.search.config.SearchConfigSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Maps budget and premium wording to a bound taken from the category price band table. Queries that
 * name a known category get that category's band and a higher confidence than the store-wide band.
 */
@Component
public class KeywordPriceStrategy implements PriceSignalStrategy {
    static final double CATEGORY_CONFIDENCE = 0.65;
    static final double STORE_CONFIDENCE = 0.55;

    private static final Pattern BUDGET = Pattern.compile(
        "\\b(?:goedkoop|goedkope|goedkoopste|voordelig|voordelige|betaalbaar|betaalbare|budget"
            + "|cheap|cheapest|affordable|inexpensive|low-cost)\\b",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Pattern PREMIUM = Pattern.compile(
        "\\b(?:duur|dure|duurste|exclusief|exclusieve|luxe|luxueus|luxueuze|premium"
            + "|expensive|luxury|luxurious|exclusive|high-end)\\b",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    @Override
    public String name() {
        return "keyword";
    }

    @Override
    public List<PriceSignal> detect(String rawQuery, SearchConfigSnapshot config) {
        List<PriceSignal> signals = new ArrayList<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return signals;
        }
        List<PriceMatch> budgetMatches = findAll(BUDGET, rawQuery);
        List<PriceMatch> premiumMatches = findAll(PREMIUM, rawQuery);
        if (budgetMatches.isEmpty() && premiumMatches.isEmpty()) {
            return signals;
        }
        Optional<CategoryPriceBand> category = config.detectCategory(rawQuery);
        CategoryPriceBand band = category.orElse(config.getStoreStatistics());
        double confidence = category.isPresent() ? CATEGORY_CONFIDENCE : STORE_CONFIDENCE;

        if (!budgetMatches.isEmpty()) {
            signals.add(new PriceSignal(null, band.getBudgetMax(), confidence, PriceIntentSource.BUDGET_KEYWORD, budgetMatches));
        }
        if (!premiumMatches.isEmpty()) {
            signals.add(new PriceSignal(band.getPremiumMin(), null, confidence, PriceIntentSource.PREMIUM_KEYWORD, premiumMatches));
        }
        return signals;
    }

    private List<PriceMatch> findAll(Pattern pattern, String text) {
        List<PriceMatch> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(new PriceMatch(matcher.start(), matcher.end(), matcher.group()));
        }
        return matches;
    }
}
