package com.findly.search.cache;

/**
 * Response classes that share a TTL. The key prefix keeps the classes apart inside one backend.
 */
public enum CacheEndpointClass {
    AI_SEARCH("ai_search:"),
    LISTING("products:"),
    AUTOCOMPLETE("suggest:");

    private final String keyPrefix;

    CacheEndpointClass(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }
}
