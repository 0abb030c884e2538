package com.findly.search.ratelimit;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.rate-limit")
public class RateLimitProperties {
    private boolean enabled = true;
    private String backend = "memory";
    private int windowSeconds = 60;
    private int aiSearchPerWindow = 60;
    /**
     * Path prefixes that consume the budget. Listing and admin routes never reach the model providers.
     */
    private List<String> protectedPaths = new ArrayList<>(List.of("/ai-search"));
    private boolean trustForwardedFor = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getAiSearchPerWindow() {
        return aiSearchPerWindow;
    }

    public void setAiSearchPerWindow(int aiSearchPerWindow) {
        this.aiSearchPerWindow = aiSearchPerWindow;
    }

    public List<String> getProtectedPaths() {
        return protectedPaths;
    }

    public void setProtectedPaths(List<String> protectedPaths) {
        this.protectedPaths = protectedPaths;
    }

    public boolean isTrustForwardedFor() {
        return trustForwardedFor;
    }

    public void setTrustForwardedFor(boolean trustForwardedFor) {
        this.trustForwardedFor = trustForwardedFor;
    }
}
