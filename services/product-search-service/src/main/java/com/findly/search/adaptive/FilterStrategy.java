package com.findly.search.adaptive;

import java.util.Collections;
import java.util.Map;

/**
 * One catalog entry. {@code expectedImprovement} only breaks priority ties; it is not a promise.
 */
public class FilterStrategy {
    private final String name;
    private final StrategyAction action;
    private final int priority;
    private final double expectedImprovement;
    private final boolean enabled;
    private final Map<String, Object> params;

    public FilterStrategy(
        String name,
        StrategyAction action,
        int priority,
        double expectedImprovement,
        boolean enabled,
        Map<String, Object> params
    ) {
        this.name = name;
        this.action = action;
        this.priority = priority;
        this.expectedImprovement = Math.max(0.0, Math.min(1.0, expectedImprovement));
        this.enabled = enabled;
        this.params = params == null ? Collections.emptyMap() : Map.copyOf(params);
    }

    public static FilterStrategy emergency() {
        return new FilterStrategy("emergency_fallback", StrategyAction.EMERGENCY_FALLBACK, 0, 0.1, true, Map.of());
    }

    public String getName() {
        return name;
    }

    public StrategyAction getAction() {
        return action;
    }

    public int getPriority() {
        return priority;
    }

    public double getExpectedImprovement() {
        return expectedImprovement;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public double doubleParam(String key, double fallback) {
        Object raw = params.get(key);
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        return fallback;
    }

    public int intParam(String key, int fallback) {
        Object raw = params.get(key);
        if (raw instanceof Number number) {
            return number.intValue();
        }
        return fallback;
    }
}
