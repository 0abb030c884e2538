package com.findly.search.adaptive;

import java.util.Locale;

public class QualitySignals {
    private final long resultCount;
    private final double categoryDiversity;
    private final Double averagePrice;
    private final boolean lowCount;
    private final boolean lowDiversity;
    private final boolean priceIncoherent;

    public QualitySignals(
        long resultCount,
        double categoryDiversity,
        Double averagePrice,
        boolean lowCount,
        boolean lowDiversity,
        boolean priceIncoherent
    ) {
        this.resultCount = resultCount;
        this.categoryDiversity = categoryDiversity;
        this.averagePrice = averagePrice;
        this.lowCount = lowCount;
        this.lowDiversity = lowDiversity;
        this.priceIncoherent = priceIncoherent;
    }

    public long getResultCount() {
        return resultCount;
    }

    public double getCategoryDiversity() {
        return categoryDiversity;
    }

    public Double getAveragePrice() {
        return averagePrice;
    }

    public boolean isLowCount() {
        return lowCount;
    }

    public boolean isLowDiversity() {
        return lowDiversity;
    }

    public boolean isPriceIncoherent() {
        return priceIncoherent;
    }

    public boolean isAcceptable() {
        return !lowCount && !lowDiversity && !priceIncoherent;
    }

    @Override
    public String toString() {
        return "count=" + resultCount + " diversity=" + String.format(Locale.ROOT, "%.2f", categoryDiversity)
            + " low_count=" + lowCount + " low_diversity=" + lowDiversity + " price_incoherent=" + priceIncoherent;
    }
}
