package com.findly.search.adaptive;

import java.util.Locale;

/**
 * The broadening transformations the engine knows how to apply. Catalog entries refer to them by
 * their wire name.
 */
public enum StrategyAction {
    PRICE_BROADEN_LOW("price_broaden_low"),
    PRICE_BROADEN_HIGH("price_broaden_high"),
    CATEGORY_BROADEN("category_broaden"),
    DIVERSITY_IMPROVE("diversity_improve"),
    MATERIAL_FALLBACK("material_fallback"),
    COLOR_FALLBACK("color_fallback"),
    EMERGENCY_FALLBACK("emergency_fallback");

    private final String wireName;

    StrategyAction(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == EMERGENCY_FALLBACK;
    }

    public static StrategyAction fromName(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (StrategyAction action : values()) {
            if (action.wireName.equals(normalized)) {
                return action;
            }
        }
        return null;
    }
}
