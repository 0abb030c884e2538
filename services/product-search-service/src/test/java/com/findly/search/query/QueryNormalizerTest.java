package com.findly.search.query;

import static org.assertj.core.api.Assertions.assertThat;

import com.findly.search.price.PriceIntent;
import com.findly.search.price.PriceIntentSource;
import com.findly.search.price.PriceMatch;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryNormalizerTest {

    private final QueryNormalizer normalizer = new QueryNormalizer();

    @Test
    void removesMatchedSpanAndCollapsesWhitespace() {
        PriceIntent intent = intent(new PriceMatch(9, 22, "onder 50 euro"));

        CleanedQuery cleaned = normalizer.clean("schoenen onder 50 euro", intent);

        assertThat(cleaned.getText()).isEqualTo("schoenen");
    }

    @Test
    void removesSeveralSpansInAnyOrder() {
        String raw = "goedkope  rode schoenen tot 40 euro";
        PriceIntent intent = intent(new PriceMatch(24, 35, "tot 40 euro"), new PriceMatch(0, 8, "goedkope"));

        CleanedQuery cleaned = normalizer.clean(raw, intent);

        assertThat(cleaned.getText()).isEqualTo("rode schoenen");
    }

    @Test
    void queryWithoutSpansIsReturnedUnchanged() {
        CleanedQuery cleaned = normalizer.clean("rode  sneakers ", PriceIntent.empty());

        assertThat(cleaned.getText()).isEqualTo("rode  sneakers ");
    }

    @Test
    void queryMadeOnlyOfPriceWordingKeepsRawText() {
        PriceIntent intent = intent(new PriceMatch(0, 13, "onder 50 euro"));

        CleanedQuery cleaned = normalizer.clean(" onder 50 euro ".trim(), intent);

        assertThat(cleaned.getText()).isEqualTo("onder 50 euro");
        assertThat(cleaned.isBlank()).isFalse();
    }

    @Test
    void nullQueryBecomesEmpty() {
        assertThat(normalizer.clean(null, PriceIntent.empty()).getText()).isEmpty();
    }

    private PriceIntent intent(PriceMatch... matches) {
        return new PriceIntent(null, 50.0, 0.9, PriceIntentSource.REGEX_RANGE, List.of(matches), false);
    }
}
