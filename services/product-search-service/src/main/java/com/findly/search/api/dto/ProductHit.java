package com.findly.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ProductHit {
    @JsonProperty("product_id")
    private String productId;

    private String title;
    private double price;
    private List<String> tags;
    private Double similarity;

    public String getProductId() {
        return productId;
    }

    public void setProductId(String productId) {
        this.productId = productId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public double getPrice() {
        return price;
    }

    public void setPrice(double price) {
        this.price = price;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public Double getSimilarity() {
        return similarity;
    }

    public void setSimilarity(Double similarity) {
        this.similarity = similarity;
    }
}
