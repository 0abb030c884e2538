package com.findly.search.adaptive;

import com.findly.search.retrieval.CandidateResult;
import com.findly.search.retrieval.PriceRange;
import com.findly.search.retrieval.RetrievalResult;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Scores a result page. Category diversity is {@code 1 - share of the dominant category} over the
 * first {@code diversity-window} results that have a category, and is only judged when the query
 * itself does not ask for a specific category.
 */
@Component
public class QualityEvaluator {
    private final AdaptiveFilterProperties properties;

    public QualityEvaluator(AdaptiveFilterProperties properties) {
        this.properties = properties;
    }

    public QualitySignals evaluate(RetrievalResult result, PriceRange intent, boolean categoryRequested) {
        List<CandidateResult> candidates = result.getCandidates();
        long count = result.getTotalCount();
        boolean lowCount = count < properties.getMinResults();

        double diversity = categoryDiversity(candidates);
        boolean lowDiversity = !categoryRequested && diversity < properties.getMinCategoryDiversity();

        Double average = averagePrice(candidates);
        boolean incoherent = average != null && isIncoherent(average, intent);

        return new QualitySignals(count, diversity, average, lowCount, lowDiversity, incoherent);
    }

    double categoryDiversity(List<CandidateResult> candidates) {
        int window = Math.max(1, properties.getDiversityWindow());
        Map<String, Integer> counts = new HashMap<>();
        int categorized = 0;
        for (CandidateResult candidate : candidates) {
            if (categorized >= window) {
                break;
            }
            if (candidate.getCategory() == null) {
                continue;
            }
            counts.merge(candidate.getCategory(), 1, Integer::sum);
            categorized++;
        }
        if (categorized < 2) {
            return 1.0;
        }
        int dominant = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        return 1.0 - ((double) dominant / categorized);
    }

    private Double averagePrice(List<CandidateResult> candidates) {
        if (candidates.isEmpty()) {
            return null;
        }
        return candidates.stream().mapToDouble(CandidateResult::getPrice).average().orElse(0.0);
    }

    private boolean isIncoherent(double average, PriceRange intent) {
        if (intent == null || !intent.isBounded()) {
            return false;
        }
        double tolerance = properties.getPriceTolerance();
        if (intent.getMax() != null && average > intent.getMax() * (1.0 + tolerance)) {
            return true;
        }
        return intent.getMin() != null && average < intent.getMin() * (1.0 - tolerance);
    }
}
