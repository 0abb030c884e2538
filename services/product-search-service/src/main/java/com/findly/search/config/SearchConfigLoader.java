package com.findly.search.config;

import com.findly.search.adaptive.FilterStrategy;
import com.findly.search.adaptive.StrategyAction;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads the versioned search configuration artifact (category price bands, vocabulary and the
 * adaptive strategy catalog) from YAML.
 */
@Component
public class SearchConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SearchConfigLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * @throws SearchConfigException when the artifact is missing or malformed
     */
    public SearchConfigSnapshot load(String location) {
        if (location == null || location.isBlank()) {
            throw new SearchConfigException("search config location is empty");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            try (InputStream input = SearchConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
                if (input == null) {
                    throw new SearchConfigException("search config not found at " + location);
                }
                return parse(input);
            } catch (IOException e) {
                throw new SearchConfigException("search config unreadable at " + location, e);
            }
        }
        Path path = Path.of(location);
        if (!Files.exists(path)) {
            throw new SearchConfigException("search config not found at " + location);
        }
        try (InputStream input = Files.newInputStream(path)) {
            return parse(input);
        } catch (IOException e) {
            throw new SearchConfigException("search config unreadable at " + location, e);
        }
    }

    @SuppressWarnings("unchecked")
    public SearchConfigSnapshot parse(InputStream input) {
        Object parsed;
        try {
            parsed = new Yaml().load(input);
        } catch (RuntimeException e) {
            throw new SearchConfigException("search config is not valid yaml", e);
        }
        if (!(parsed instanceof Map<?, ?> map)) {
            throw new SearchConfigException("search config malformed (root not map)");
        }
        Map<String, Object> root = (Map<String, Object>) map;

        String version = asString(root.get("version"), null);
        if (version == null) {
            throw new SearchConfigException("search config has no version");
        }
        CategoryPriceBand storeStatistics = parseStoreStatistics(root.get("store_statistics"));
        Map<String, CategoryPriceBand> bands = parsePriceBands(root.get("price_bands"));
        Map<String, List<String>> related = parseRelated(root.get("related_categories"));
        List<String> materials = toStringList(root.get("materials"));
        List<String> colors = toStringList(root.get("colors"));
        List<FilterStrategy> strategies = parseStrategies(root.get("strategies"));

        return new SearchConfigSnapshot(version, storeStatistics, bands, related, materials, colors, strategies);
    }

    private CategoryPriceBand parseStoreStatistics(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return new CategoryPriceBand("store", 50.0, 150.0, List.of());
        }
        double budget = asDouble(map.get("budget_max"), 50.0);
        double premium = asDouble(map.get("premium_min"), 150.0);
        return new CategoryPriceBand("store", budget, premium, List.of());
    }

    private Map<String, CategoryPriceBand> parsePriceBands(Object raw) {
        Map<String, CategoryPriceBand> bands = new LinkedHashMap<>();
        if (!(raw instanceof Map<?, ?> map)) {
            return bands;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String category = asString(entry.getKey(), null);
            if (category == null || !(entry.getValue() instanceof Map<?, ?> bandMap)) {
                continue;
            }
            Double budget = asDouble(bandMap.get("budget_max"), null);
            Double premium = asDouble(bandMap.get("premium_min"), null);
            if (budget == null || premium == null || budget <= 0 || premium <= 0) {
                log.warn("price band skipped category={} reason=missing_bounds", category);
                continue;
            }
            List<String> keywords = new ArrayList<>();
            for (String keyword : toStringList(bandMap.get("keywords"))) {
                keywords.add(keyword.toLowerCase(Locale.ROOT));
            }
            bands.put(category, new CategoryPriceBand(category, budget, premium, keywords));
        }
        return bands;
    }

    private Map<String, List<String>> parseRelated(Object raw) {
        Map<String, List<String>> related = new LinkedHashMap<>();
        if (!(raw instanceof Map<?, ?> map)) {
            return related;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String category = asString(entry.getKey(), null);
            if (category != null) {
                related.put(category, toStringList(entry.getValue()));
            }
        }
        return related;
    }

    @SuppressWarnings("unchecked")
    private List<FilterStrategy> parseStrategies(Object raw) {
        List<FilterStrategy> strategies = new ArrayList<>();
        if (!(raw instanceof List<?> list)) {
            return strategies;
        }
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                continue;
            }
            String name = asString(map.get("name"), null);
            StrategyAction action = StrategyAction.fromName(asString(map.get("action"), name));
            if (name == null || action == null) {
                log.warn("strategy skipped name={} reason=unknown_action", name);
                continue;
            }
            int priority = asDouble(map.get("priority"), 0.0).intValue();
            double expected = asDouble(map.get("expected_improvement"), 0.0);
            boolean enabled = !(map.get("enabled") instanceof Boolean flag) || flag;
            Map<String, Object> params = map.get("params") instanceof Map<?, ?> paramMap
                ? new LinkedHashMap<>((Map<String, Object>) paramMap)
                : Map.of();
            strategies.add(new FilterStrategy(name, action, priority, expected, enabled, params));
        }
        return strategies;
    }

    private List<String> toStringList(Object raw) {
        List<String> values = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object entry : list) {
                String value = asString(entry, null);
                if (value != null) {
                    values.add(value);
                }
            }
        }
        return values;
    }

    private String asString(Object raw, String fallback) {
        if (raw == null) {
            return fallback;
        }
        String value = raw.toString().trim();
        return value.isEmpty() ? fallback : value;
    }

    private Double asDouble(Object raw, Double fallback) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }
}
