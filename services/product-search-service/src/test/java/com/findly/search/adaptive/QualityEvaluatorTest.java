package com.findly.search.adaptive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.findly.search.retrieval.CandidateResult;
import com.findly.search.retrieval.PriceRange;
import com.findly.search.retrieval.RetrievalResult;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class QualityEvaluatorTest {

    private final QualityEvaluator evaluator = new QualityEvaluator(new AdaptiveFilterProperties());

    @Test
    void fewResultsAreLowCount() {
        RetrievalResult result = new RetrievalResult(List.of(item("a", "shoes", 40.0), item("b", "coats", 45.0)), 2);

        QualitySignals signals = evaluator.evaluate(result, PriceRange.of(null, 50.0), false);

        assertThat(signals.isLowCount()).isTrue();
        assertThat(signals.isPriceIncoherent()).isFalse();
        assertThat(signals.isAcceptable()).isFalse();
    }

    @Test
    void diversityIsOneMinusDominantShare() {
        List<CandidateResult> candidates = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            candidates.add(item("s" + i, "shoes", 40.0));
        }
        candidates.add(item("c0", "coats", 40.0));
        candidates.add(item("c1", "coats", 40.0));
        candidates.add(item("late", "shirts", 40.0));

        QualitySignals signals = evaluator.evaluate(new RetrievalResult(candidates, 11), PriceRange.unbounded(), false);

        assertThat(signals.getCategoryDiversity()).isCloseTo(0.2, within(1e-9));
        assertThat(signals.isLowDiversity()).isTrue();
    }

    @Test
    void diversityIsIgnoredWhenCategoryRequested() {
        List<CandidateResult> candidates = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            candidates.add(item("s" + i, "shoes", 60.0));
        }

        QualitySignals signals = evaluator.evaluate(new RetrievalResult(candidates, 10), PriceRange.unbounded(), true);

        assertThat(signals.getCategoryDiversity()).isZero();
        assertThat(signals.isLowDiversity()).isFalse();
        assertThat(signals.isAcceptable()).isTrue();
    }

    @Test
    void averageFarAboveIntentIsIncoherent() {
        List<CandidateResult> candidates = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            candidates.add(item("p" + i, i % 2 == 0 ? "shoes" : "coats", 70.0));
        }

        QualitySignals above = evaluator.evaluate(new RetrievalResult(candidates, 6), PriceRange.of(null, 50.0), false);
        QualitySignals within = evaluator.evaluate(new RetrievalResult(candidates, 6), PriceRange.of(null, 60.0), false);
        QualitySignals below = evaluator.evaluate(new RetrievalResult(candidates, 6), PriceRange.of(100.0, null), false);

        assertThat(above.isPriceIncoherent()).isTrue();
        assertThat(within.isPriceIncoherent()).isFalse();
        assertThat(below.isPriceIncoherent()).isTrue();
        assertThat(above.getAveragePrice()).isEqualTo(70.0);
    }

    @Test
    void uncategorizedResultsCountAsDiverse() {
        List<CandidateResult> candidates = List.of(item("a", null, 10.0), item("b", null, 12.0));

        assertThat(evaluator.categoryDiversity(candidates)).isEqualTo(1.0);
    }

    private CandidateResult item(String id, String category, double price) {
        return new CandidateResult(id, "Product " + id, price, List.of(), category, 0.8);
    }
}
