package com.findly.search.execution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.execution")
public class SearchExecutionProperties {
    private int poolSize = 16;
    private int searchQueueCapacity = 64;
    private int auxPoolSize = 4;
    private int auxQueueCapacity = 32;
    private int analyticsQueueCapacity = 1000;
    private long requestTimeoutMs = 8000;

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public int getSearchQueueCapacity() {
        return searchQueueCapacity;
    }

    public void setSearchQueueCapacity(int searchQueueCapacity) {
        this.searchQueueCapacity = searchQueueCapacity;
    }

    public int getAuxQueueCapacity() {
        return auxQueueCapacity;
    }

    public void setAuxQueueCapacity(int auxQueueCapacity) {
        this.auxQueueCapacity = auxQueueCapacity;
    }

    public int getAuxPoolSize() {
        return auxPoolSize;
    }

    public void setAuxPoolSize(int auxPoolSize) {
        this.auxPoolSize = auxPoolSize;
    }

    public int getAnalyticsQueueCapacity() {
        return analyticsQueueCapacity;
    }

    public void setAnalyticsQueueCapacity(int analyticsQueueCapacity) {
        this.analyticsQueueCapacity = analyticsQueueCapacity;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }
}
