package com.findly.search.opensearch;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "opensearch")
public class OpenSearchProperties {
    private String baseUrl;
    private String productIndex = "products";
    private String vectorField = "embedding";
    private int connectTimeoutMs = 500;
    private int readTimeoutMs = 2000;
    private int knnCandidates = 500;
    private int fallbackCandidates = 200;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getProductIndex() {
        return productIndex;
    }

    public void setProductIndex(String productIndex) {
        this.productIndex = productIndex;
    }

    public String getVectorField() {
        return vectorField;
    }

    public void setVectorField(String vectorField) {
        this.vectorField = vectorField;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public int getKnnCandidates() {
        return knnCandidates;
    }

    public void setKnnCandidates(int knnCandidates) {
        this.knnCandidates = knnCandidates;
    }

    public int getFallbackCandidates() {
        return fallbackCandidates;
    }

    public void setFallbackCandidates(int fallbackCandidates) {
        this.fallbackCandidates = fallbackCandidates;
    }
}
