package com.findly.search.service;

import com.findly.search.query.TargetLanguage;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search")
public class SearchProperties {
    private TargetLanguage storeLanguage = TargetLanguage.NL;
    private int maxQueryLength = 500;
    private int defaultLimit = 25;
    private int maxLimit = 100;
    private int maxListingLimit = 250;

    public TargetLanguage getStoreLanguage() {
        return storeLanguage;
    }

    public void setStoreLanguage(TargetLanguage storeLanguage) {
        this.storeLanguage = storeLanguage;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getMaxListingLimit() {
        return maxListingLimit;
    }

    public void setMaxListingLimit(int maxListingLimit) {
        this.maxListingLimit = maxListingLimit;
    }
}
