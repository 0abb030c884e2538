package com.findly.search.query;

import com.findly.search.price.PriceIntent;
import com.findly.search.price.PriceMatch;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Removes exactly the spans the winning price signals matched. A query with no matched spans is
 * returned unchanged.
 */
@Component
public class QueryNormalizer {

    public CleanedQuery clean(String rawQuery, PriceIntent intent) {
        if (rawQuery == null) {
            return new CleanedQuery("");
        }
        if (intent == null || intent.getMatches().isEmpty()) {
            return new CleanedQuery(rawQuery);
        }
        List<PriceMatch> spans = new ArrayList<>(intent.getMatches());
        spans.sort(Comparator.comparingInt(PriceMatch::getStart));

        StringBuilder cleaned = new StringBuilder(rawQuery.length());
        int cursor = 0;
        for (PriceMatch span : spans) {
            int start = Math.max(cursor, Math.min(span.getStart(), rawQuery.length()));
            int end = Math.max(start, Math.min(span.getEnd(), rawQuery.length()));
            cleaned.append(rawQuery, cursor, start).append(' ');
            cursor = end;
        }
        cleaned.append(rawQuery.substring(cursor));

        String collapsed = cleaned.toString().replaceAll("\\s+", " ").trim();
        // a query made only of price wording keeps its original text for embedding
        return new CleanedQuery(collapsed.isEmpty() ? rawQuery.trim() : collapsed);
    }
}
