package com.findly.search.price;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.price-intent")
public class PriceIntentProperties {
    private double confidenceThreshold = 0.5;
    private boolean llmEnabled = true;
    private boolean storeFallbackEnabled = true;
    private double storeFallbackConfidence = 0.3;
    private double llmConfidence = 0.6;

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public boolean isLlmEnabled() {
        return llmEnabled;
    }

    public void setLlmEnabled(boolean llmEnabled) {
        this.llmEnabled = llmEnabled;
    }

    public boolean isStoreFallbackEnabled() {
        return storeFallbackEnabled;
    }

    public void setStoreFallbackEnabled(boolean storeFallbackEnabled) {
        this.storeFallbackEnabled = storeFallbackEnabled;
    }

    public double getStoreFallbackConfidence() {
        return storeFallbackConfidence;
    }

    public void setStoreFallbackConfidence(double storeFallbackConfidence) {
        this.storeFallbackConfidence = storeFallbackConfidence;
    }

    public double getLlmConfidence() {
        return llmConfidence;
    }

    public void setLlmConfidence(double llmConfidence) {
        this.llmConfidence = llmConfidence;
    }
}
