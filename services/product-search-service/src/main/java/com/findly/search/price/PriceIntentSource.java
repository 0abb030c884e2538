package com.findly.search.price;

public enum PriceIntentSource {
    REGEX_EXACT("regex_exact"),
    REGEX_RANGE("regex_range"),
    BUDGET_KEYWORD("budget_keyword"),
    PREMIUM_KEYWORD("premium_keyword"),
    LLM_INFERENCE("llm_inference"),
    STORE_STATISTICAL_FALLBACK("store_statistical_fallback");

    private final String wireName;

    PriceIntentSource(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isDeterministicPattern() {
        return this == REGEX_EXACT || this == REGEX_RANGE;
    }
}
