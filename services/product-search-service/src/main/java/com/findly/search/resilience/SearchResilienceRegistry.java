package com.findly.search.resilience;

import org.springframework.stereotype.Component;

@Component
public class SearchResilienceRegistry {
    private final CircuitBreaker embedBreaker;
    private final CircuitBreaker storeBreaker;

    public SearchResilienceRegistry(SearchResilienceProperties properties) {
        this.embedBreaker = new CircuitBreaker(
            "embedding",
            properties.getEmbedFailureThreshold(),
            properties.getEmbedOpenMs()
        );
        this.storeBreaker = new CircuitBreaker(
            "store",
            properties.getStoreFailureThreshold(),
            properties.getStoreOpenMs()
        );
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }

    public CircuitBreaker getStoreBreaker() {
        return storeBreaker;
    }
}
