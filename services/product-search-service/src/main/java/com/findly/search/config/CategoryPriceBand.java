package com.findly.search.config;

import java.util.Collections;
import java.util.List;

/**
 * Fallback prices for budget and premium wording within one product category.
 */
public class CategoryPriceBand {
    private final String category;
    private final double budgetMax;
    private final double premiumMin;
    private final List<String> keywords;

    public CategoryPriceBand(String category, double budgetMax, double premiumMin, List<String> keywords) {
        this.category = category;
        this.budgetMax = budgetMax;
        this.premiumMin = premiumMin;
        this.keywords = keywords == null ? Collections.emptyList() : List.copyOf(keywords);
    }

    public String getCategory() {
        return category;
    }

    public double getBudgetMax() {
        return budgetMax;
    }

    public double getPremiumMin() {
        return premiumMin;
    }

    public List<String> getKeywords() {
        return keywords;
    }
}
