package com.findly.search.retrieval;

import java.util.Objects;

public final class PriceRange {
    private static final PriceRange UNBOUNDED = new PriceRange(null, null);

    private final Double min;
    private final Double max;

    private PriceRange(Double min, Double max) {
        this.min = min;
        this.max = max;
    }

    public static PriceRange of(Double min, Double max) {
        if (min == null && max == null) {
            return UNBOUNDED;
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("min " + min + " exceeds max " + max);
        }
        return new PriceRange(min, max);
    }

    public static PriceRange unbounded() {
        return UNBOUNDED;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public boolean isBounded() {
        return min != null || max != null;
    }

    public PriceRange withMin(Double newMin) {
        return of(newMin, max);
    }

    public PriceRange withMax(Double newMax) {
        return of(min, newMax);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PriceRange that)) {
            return false;
        }
        return Objects.equals(min, that.min) && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "[" + (min == null ? "-" : min) + ", " + (max == null ? "-" : max) + "]";
    }
}
