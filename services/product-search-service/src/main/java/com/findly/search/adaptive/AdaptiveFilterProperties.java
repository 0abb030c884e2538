package com.findly.search.adaptive;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.adaptive")
public class AdaptiveFilterProperties {
    private boolean enabled = true;
    private int minResults = 5;
    private double minCategoryDiversity = 0.3;
    private double priceTolerance = 0.25;
    private int maxStrategies = 3;
    private int diversityWindow = 10;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMinResults() {
        return minResults;
    }

    public void setMinResults(int minResults) {
        this.minResults = minResults;
    }

    public double getMinCategoryDiversity() {
        return minCategoryDiversity;
    }

    public void setMinCategoryDiversity(double minCategoryDiversity) {
        this.minCategoryDiversity = minCategoryDiversity;
    }

    public double getPriceTolerance() {
        return priceTolerance;
    }

    public void setPriceTolerance(double priceTolerance) {
        this.priceTolerance = priceTolerance;
    }

    public int getMaxStrategies() {
        return maxStrategies;
    }

    public void setMaxStrategies(int maxStrategies) {
        this.maxStrategies = maxStrategies;
    }

    public int getDiversityWindow() {
        return diversityWindow;
    }

    public void setDiversityWindow(int diversityWindow) {
        this.diversityWindow = diversityWindow;
    }
}
