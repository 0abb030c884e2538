package com.findly.search.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.findly.search.adaptive.FilterStrategy;
import com.findly.search.adaptive.StrategyAction;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class SearchConfigLoaderTest {

    private final SearchConfigLoader loader = new SearchConfigLoader();

    @Test
    void loadsBundledConfig() {
        SearchConfigSnapshot snapshot = loader.load("classpath:search-config.yml");

        assertThat(snapshot.getVersion()).isEqualTo("2024-06-01");
        assertThat(snapshot.getStoreStatistics().getBudgetMax()).isEqualTo(50.0);
        assertThat(snapshot.getStoreStatistics().getPremiumMin()).isEqualTo(150.0);
        assertThat(snapshot.getPriceBands()).containsKeys("shoes", "coats", "shirts", "accessories");
        assertThat(snapshot.getPriceBands().get("shoes").getBudgetMax()).isEqualTo(120.0);

        assertThat(snapshot.getStrategies()).extracting(FilterStrategy::getName).first().isEqualTo("price_broaden_high");
        FilterStrategy last = snapshot.getStrategies().get(snapshot.getStrategies().size() - 1);
        assertThat(last.getAction()).isEqualTo(StrategyAction.EMERGENCY_FALLBACK);
    }

    @Test
    void detectsCategoryByWholeWord() {
        SearchConfigSnapshot snapshot = loader.load("classpath:search-config.yml");

        assertThat(snapshot.detectCategory("Zwarte SNEAKERS maat 42")).map(CategoryPriceBand::getCategory).contains("shoes");
        assertThat(snapshot.detectCategory("wit t-shirt")).map(CategoryPriceBand::getCategory).contains("shirts");
        assertThat(snapshot.detectCategory("jasmijn thee")).isEmpty();
        assertThat(snapshot.detectCategory(null)).isEmpty();
    }

    @Test
    void appendsEmergencyWhenCatalogOmitsIt() {
        SearchConfigSnapshot snapshot = loader.parse(yaml(
            "version: v2\n"
                + "strategies:\n"
                + "  - name: color_fallback\n"
                + "    priority: 10\n"
                + "  - name: price_broaden_low\n"
                + "    priority: 20\n"
                + "  - name: teleport\n"
                + "    priority: 99\n"
        ));

        assertThat(snapshot.getStrategies())
            .extracting(FilterStrategy::getAction)
            .containsExactly(StrategyAction.PRICE_BROADEN_LOW, StrategyAction.COLOR_FALLBACK, StrategyAction.EMERGENCY_FALLBACK);
    }

    @Test
    void emergencyRunsLastEvenWithHighPriority() {
        SearchConfigSnapshot snapshot = loader.parse(yaml(
            "version: v3\n"
                + "strategies:\n"
                + "  - name: emergency_fallback\n"
                + "    priority: 100\n"
                + "  - name: category_broaden\n"
                + "    priority: 5\n"
        ));

        assertThat(snapshot.getStrategies())
            .extracting(FilterStrategy::getAction)
            .containsExactly(StrategyAction.CATEGORY_BROADEN, StrategyAction.EMERGENCY_FALLBACK);
    }

    @Test
    void skipsBandsWithoutBounds() {
        SearchConfigSnapshot snapshot = loader.parse(yaml(
            "version: v4\n"
                + "price_bands:\n"
                + "  shoes:\n"
                + "    budget_max: 100\n"
                + "    keywords: [Schoenen]\n"
                + "  bags:\n"
                + "    budget_max: 40\n"
                + "    premium_min: 90\n"
                + "    keywords: [Tas]\n"
        ));

        assertThat(snapshot.getPriceBands()).containsOnlyKeys("bags");
        assertThat(snapshot.getPriceBands().get("bags").getKeywords()).containsExactly("tas");
    }

    @Test
    void rejectsArtifactsWithoutVersion() {
        assertThatThrownBy(() -> loader.parse(yaml("price_bands: {}\n")))
            .isInstanceOf(SearchConfigException.class)
            .hasMessageContaining("version");
    }

    @Test
    void rejectsNonMapRoot() {
        assertThatThrownBy(() -> loader.parse(yaml("- just\n- a list\n")))
            .isInstanceOf(SearchConfigException.class);
    }

    @Test
    void missingLocationsFail() {
        assertThatThrownBy(() -> loader.load("classpath:does-not-exist.yml"))
            .isInstanceOf(SearchConfigException.class);
        assertThatThrownBy(() -> loader.load("/nonexistent/search-config.yml"))
            .isInstanceOf(SearchConfigException.class);
        assertThatThrownBy(() -> loader.load(" "))
            .isInstanceOf(SearchConfigException.class);
    }

    private InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
