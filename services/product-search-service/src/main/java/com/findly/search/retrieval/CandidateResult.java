package com.findly.search.retrieval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

public class CandidateResult {
    private final String productId;
    private final String title;
    private final double price;
    private final List<String> tags;
    private final String category;
    private final double similarity;

    public CandidateResult(String productId, String title, double price, List<String> tags, String category, double similarity) {
        this.productId = productId;
        this.title = title;
        this.price = price;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(new ArrayList<>(new LinkedHashSet<>(tags)));
        this.category = category;
        this.similarity = similarity;
    }

    public String getProductId() {
        return productId;
    }

    public String getTitle() {
        return title;
    }

    public double getPrice() {
        return price;
    }

    /**
     * Distinct tags in store order.
     */
    public List<String> getTags() {
        return tags;
    }

    /**
     * Category from the store document, or the category inferred from the tags; may be null.
     */
    public String getCategory() {
        return category;
    }

    public double getSimilarity() {
        return similarity;
    }
}
