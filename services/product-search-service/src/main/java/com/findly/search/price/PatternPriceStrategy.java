package com.findly.search.price;

import com.findly.search.config.SearchConfigSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.springframework.stereotype.Component;

@Component
public class PatternPriceStrategy implements PriceSignalStrategy {

    @Override
    public String name() {
        return "pattern";
    }

    @Override
    public List<PriceSignal> detect(String rawQuery, SearchConfigSnapshot config) {
        List<PriceSignal> signals = new ArrayList<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return signals;
        }
        List<PriceMatch> claimed = new ArrayList<>();
        for (PricePatternTable.Entry entry : PricePatternTable.ENTRIES) {
            Matcher matcher = entry.pattern().matcher(rawQuery);
            while (matcher.find()) {
                PriceMatch span = new PriceMatch(matcher.start(), matcher.end(), matcher.group());
                if (claimed.stream().anyMatch(span::overlaps)) {
                    continue;
                }
                PriceSignal signal = toSignal(entry.kind(), matcher, span);
                if (signal != null) {
                    claimed.add(span);
                    signals.add(signal);
                }
            }
        }
        return signals;
    }

    private PriceSignal toSignal(PricePatternTable.Kind kind, Matcher matcher, PriceMatch span) {
        double first = PricePatternTable.parse(firstNumber(matcher));
        Double min;
        Double max;
        switch (kind) {
            case RANGE -> {
                double second = PricePatternTable.parse(secondNumber(matcher));
                min = Math.min(first, second);
                max = Math.max(first, second);
            }
            case BELOW -> {
                min = null;
                max = first;
            }
            case ABOVE -> {
                min = first;
                max = null;
            }
            case APPROXIMATE -> {
                min = first * 0.8;
                max = first * 1.2;
            }
            case EXACT -> {
                min = first * 0.9;
                max = first * 1.1;
            }
            default -> {
                return null;
            }
        }
        if ((max != null && max <= 0) || (min != null && min < 0)) {
            return null;
        }
        return new PriceSignal(min, max, kind.confidence(), kind.source(), List.of(span));
    }

    private String firstNumber(Matcher matcher) {
        for (int i = 1; i <= matcher.groupCount(); i++) {
            if (matcher.group(i) != null) {
                return matcher.group(i);
            }
        }
        throw new IllegalStateException("price pattern without number group");
    }

    private String secondNumber(Matcher matcher) {
        boolean seenFirst = false;
        for (int i = 1; i <= matcher.groupCount(); i++) {
            if (matcher.group(i) != null) {
                if (seenFirst) {
                    return matcher.group(i);
                }
                seenFirst = true;
            }
        }
        throw new IllegalStateException("range pattern without second number");
    }
}
