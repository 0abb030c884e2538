package com.findly.search.price;

import com.findly.search.query.TargetLanguage;
import java.util.Locale;

public final class PriceLabelFormatter {

    private PriceLabelFormatter() {
    }

    /**
     * Human readable label for the applied bounds, or null when there are none.
     */
    public static String format(Double minPrice, Double maxPrice, TargetLanguage language) {
        boolean dutch = language != TargetLanguage.EN;
        String prefix = dutch ? "Prijs: " : "Price: ";
        if (minPrice != null && maxPrice != null) {
            if (Math.abs(maxPrice - minPrice) < 0.01) {
                return prefix + euro(minPrice);
            }
            return prefix + euro(minPrice) + " - " + euro(maxPrice);
        }
        if (minPrice != null) {
            return prefix + (dutch ? "vanaf " : "from ") + euro(minPrice);
        }
        if (maxPrice != null) {
            return prefix + (dutch ? "tot " : "up to ") + euro(maxPrice);
        }
        return null;
    }

    private static String euro(double value) {
        return String.format(Locale.ROOT, "€%.2f", value);
    }
}
