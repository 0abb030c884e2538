package com.findly.search.opensearch;

import java.util.Collections;
import java.util.List;

/**
 * One product hit as returned by the store. {@code score} is null for non-vector queries.
 */
public class ProductDocument {
    private final String productId;
    private final String title;
    private final double price;
    private final List<String> tags;
    private final String category;
    private final Double score;

    public ProductDocument(String productId, String title, double price, List<String> tags, String category, Double score) {
        this.productId = productId;
        this.title = title;
        this.price = price;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
        this.category = category;
        this.score = score;
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

    public List<String> getTags() {
        return tags;
    }

    public String getCategory() {
        return category;
    }

    public Double getScore() {
        return score;
    }
}
