package com.findly.search.config;

import com.findly.search.adaptive.FilterStrategy;
import com.findly.search.adaptive.StrategyAction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of one version of the search configuration artifact. Never mutated after
 * construction; a reload replaces the whole snapshot.
 */
public class SearchConfigSnapshot {
    private final String version;
    private final CategoryPriceBand storeStatistics;
    private final Map<String, CategoryPriceBand> priceBands;
    private final Map<String, List<String>> relatedCategories;
    private final List<String> materials;
    private final List<String> colors;
    private final List<FilterStrategy> strategies;

    public SearchConfigSnapshot(
        String version,
        CategoryPriceBand storeStatistics,
        Map<String, CategoryPriceBand> priceBands,
        Map<String, List<String>> relatedCategories,
        List<String> materials,
        List<String> colors,
        List<FilterStrategy> strategies
    ) {
        this.version = version;
        this.storeStatistics = storeStatistics;
        this.priceBands = priceBands == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(priceBands));
        Map<String, List<String>> related = new LinkedHashMap<>();
        if (relatedCategories != null) {
            relatedCategories.forEach((key, value) -> related.put(key, List.copyOf(value)));
        }
        this.relatedCategories = Collections.unmodifiableMap(related);
        this.materials = materials == null ? Collections.emptyList() : List.copyOf(materials);
        this.colors = colors == null ? Collections.emptyList() : List.copyOf(colors);
        this.strategies = orderCatalog(strategies);
    }

    public static SearchConfigSnapshot defaults() {
        return new SearchConfigSnapshot(
            "builtin",
            new CategoryPriceBand("store", 50.0, 150.0, List.of()),
            Map.of(),
            Map.of(),
            List.of(),
            List.of(),
            List.of()
        );
    }

    private static List<FilterStrategy> orderCatalog(List<FilterStrategy> raw) {
        List<FilterStrategy> ordered = new ArrayList<>();
        boolean hasEmergency = false;
        if (raw != null) {
            for (FilterStrategy strategy : raw) {
                if (strategy.getAction() == StrategyAction.EMERGENCY_FALLBACK) {
                    hasEmergency = true;
                }
                ordered.add(strategy);
            }
        }
        if (!hasEmergency) {
            ordered.add(FilterStrategy.emergency());
        }
        // emergency_fallback always runs last regardless of its configured priority
        ordered.sort(Comparator
            .comparing((FilterStrategy s) -> s.getAction().isTerminal())
            .thenComparing(FilterStrategy::getPriority, Comparator.reverseOrder())
            .thenComparing(FilterStrategy::getExpectedImprovement, Comparator.reverseOrder()));
        return List.copyOf(ordered);
    }

    public String getVersion() {
        return version;
    }

    public CategoryPriceBand getStoreStatistics() {
        return storeStatistics;
    }

    public Map<String, CategoryPriceBand> getPriceBands() {
        return priceBands;
    }

    public Map<String, List<String>> getRelatedCategories() {
        return relatedCategories;
    }

    public List<String> getMaterials() {
        return materials;
    }

    public List<String> getColors() {
        return colors;
    }

    /**
     * Strategies in application order: highest priority first, the terminal emergency strategy last.
     */
    public List<FilterStrategy> getStrategies() {
        return strategies;
    }

    /**
     * Finds the first category whose keyword occurs as a whole word in the text.
     */
    public Optional<CategoryPriceBand> detectCategory(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        List<String> tokens = tokenize(text);
        for (CategoryPriceBand band : priceBands.values()) {
            for (String keyword : band.getKeywords()) {
                if (tokens.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return Optional.of(band);
                }
            }
        }
        return Optional.empty();
    }

    public List<String> relatedTo(String category) {
        if (category == null) {
            return List.of();
        }
        return relatedCategories.getOrDefault(category, List.of());
    }

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}-]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
