package com.findly.search.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.config")
public class SearchConfigProperties {
    private String location = "classpath:search-config.yml";
    private boolean reloadEnabled = true;
    private long reloadIntervalMs = 300000;

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public boolean isReloadEnabled() {
        return reloadEnabled;
    }

    public void setReloadEnabled(boolean reloadEnabled) {
        this.reloadEnabled = reloadEnabled;
    }

    public long getReloadIntervalMs() {
        return reloadIntervalMs;
    }

    public void setReloadIntervalMs(long reloadIntervalMs) {
        this.reloadIntervalMs = reloadIntervalMs;
    }
}
