package com.findly.search.price;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Dutch and English price phrasings, evaluated in declaration order. Earlier kinds claim their span
 * first so that "50 euro of minder" is read as an upper bound rather than as an exact price.
 */
final class PricePatternTable {
    static final String NUM = "(\\d+(?:[.,]\\d+)?)";
    private static final String PRE = "(?:(?<!\\w)€\\s*|\\beuro\\s+)?";
    private static final String POST = "(?:\\s*(?:euro|eur|€)(?!\\w))?";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    enum Kind {
        RANGE(0.95, PriceIntentSource.REGEX_RANGE),
        BELOW(0.9, PriceIntentSource.REGEX_RANGE),
        ABOVE(0.9, PriceIntentSource.REGEX_RANGE),
        APPROXIMATE(0.8, PriceIntentSource.REGEX_EXACT),
        EXACT(0.85, PriceIntentSource.REGEX_EXACT);

        private final double confidence;
        private final PriceIntentSource source;

        Kind(double confidence, PriceIntentSource source) {
            this.confidence = confidence;
            this.source = source;
        }

        double confidence() {
            return confidence;
        }

        PriceIntentSource source() {
            return source;
        }
    }

    static final class Entry {
        private final Kind kind;
        private final Pattern pattern;

        private Entry(Kind kind, String regex) {
            this.kind = kind;
            this.pattern = Pattern.compile(regex, FLAGS);
        }

        Kind kind() {
            return kind;
        }

        Pattern pattern() {
            return pattern;
        }
    }

    static final List<Entry> ENTRIES = List.of(
        new Entry(Kind.RANGE,
            "\\b(?:tussen|between)\\s+" + PRE + NUM + POST + "\\s+(?:en|and)\\s+" + PRE + NUM + POST),
        new Entry(Kind.RANGE,
            PRE + "\\b" + NUM + POST + "\\s*[-–—]\\s*" + PRE + NUM + "\\b" + POST),
        new Entry(Kind.BELOW,
            "\\b(?:onder|below|under|less than|minder dan|max(?:imaal|imum)?|tot|up to)\\s+" + PRE + NUM + POST),
        new Entry(Kind.BELOW,
            PRE + "\\b" + NUM + POST + "\\s+(?:of minder|or less)\\b"),
        new Entry(Kind.ABOVE,
            "\\b(?:boven|above|more than|meer dan|min(?:imaal|imum)?|vanaf)\\s+" + PRE + NUM + POST),
        new Entry(Kind.ABOVE,
            PRE + "\\b" + NUM + POST + "\\s+(?:of meer|or more)\\b"),
        new Entry(Kind.APPROXIMATE,
            "\\b(?:ongeveer|rond(?:\\s+de)?|circa|about|around)\\s+" + PRE + NUM + POST),
        new Entry(Kind.EXACT,
            "(?:(?<!\\w)€\\s*|\\beuro\\s+)" + NUM + "\\b"),
        new Entry(Kind.EXACT,
            "\\b" + NUM + "\\s*(?:euro|eur|€)(?!\\w)")
    );

    private PricePatternTable() {
    }

    static double parse(String raw) {
        return Double.parseDouble(raw.replace(',', '.'));
    }
}
