package com.findly.search.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.resilience")
public class SearchResilienceProperties {
    private int embedFailureThreshold = 5;
    private long embedOpenMs = 30000;
    private int storeFailureThreshold = 5;
    private long storeOpenMs = 15000;

    public int getEmbedFailureThreshold() {
        return embedFailureThreshold;
    }

    public void setEmbedFailureThreshold(int embedFailureThreshold) {
        this.embedFailureThreshold = embedFailureThreshold;
    }

    public long getEmbedOpenMs() {
        return embedOpenMs;
    }

    public void setEmbedOpenMs(long embedOpenMs) {
        this.embedOpenMs = embedOpenMs;
    }

    public int getStoreFailureThreshold() {
        return storeFailureThreshold;
    }

    public void setStoreFailureThreshold(int storeFailureThreshold) {
        this.storeFailureThreshold = storeFailureThreshold;
    }

    public long getStoreOpenMs() {
        return storeOpenMs;
    }

    public void setStoreOpenMs(long storeOpenMs) {
        this.storeOpenMs = storeOpenMs;
    }
}
