package com.findly.search.query;

import java.util.Objects;

/**
 * Search text with the recognised price phrases removed. Used for embedding and cache keys.
 */
public final class CleanedQuery {
    private final String text;

    public CleanedQuery(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CleanedQuery that)) {
            return false;
        }
        return text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
