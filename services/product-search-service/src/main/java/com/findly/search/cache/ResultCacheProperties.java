package com.findly.search.cache;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.cache")
public class ResultCacheProperties {
    private boolean enabled = true;
    private Backend backend = Backend.MEMORY;
    private String keyPrefix = "findly:";
    private int maxEntries = 5000;
    private Duration aiSearchTtl = Duration.ofMinutes(15);
    private Duration listingTtl = Duration.ofMinutes(60);
    private Duration autocompleteTtl = Duration.ofMinutes(5);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public Duration getAiSearchTtl() {
        return aiSearchTtl;
    }

    public void setAiSearchTtl(Duration aiSearchTtl) {
        this.aiSearchTtl = aiSearchTtl;
    }

    public Duration getListingTtl() {
        return listingTtl;
    }

    public void setListingTtl(Duration listingTtl) {
        this.listingTtl = listingTtl;
    }

    public Duration getAutocompleteTtl() {
        return autocompleteTtl;
    }

    public void setAutocompleteTtl(Duration autocompleteTtl) {
        this.autocompleteTtl = autocompleteTtl;
    }

    public Duration ttlFor(CacheEndpointClass endpointClass) {
        return switch (endpointClass) {
            case LISTING -> listingTtl;
            case AUTOCOMPLETE -> autocompleteTtl;
            case AI_SEARCH -> aiSearchTtl;
        };
    }

    public enum Backend {
        MEMORY,
        REDIS
    }
}
