package com.findly.search.price;

/**
 * A span of the raw query that expressed a price constraint. Offsets index into the raw query.
 */
public class PriceMatch {
    private final int start;
    private final int end;
    private final String text;

    public PriceMatch(int start, int end, String text) {
        this.start = start;
        this.end = end;
        this.text = text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getText() {
        return text;
    }

    public boolean overlaps(PriceMatch other) {
        return start < other.end && other.start < end;
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")'" + text + "'";
    }
}
