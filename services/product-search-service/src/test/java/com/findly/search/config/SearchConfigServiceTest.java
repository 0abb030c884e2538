package com.findly.search.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SearchConfigServiceTest {

    @Test
    void fallsBackToDefaultsWhenInitialLoadFails() {
        SearchConfigLoader loader = mock(SearchConfigLoader.class);
        when(loader.load("classpath:search-config.yml")).thenThrow(new SearchConfigException("search config not found"));

        SearchConfigService service = new SearchConfigService(loader, new SearchConfigProperties());
        service.init();

        SearchConfigSnapshot snapshot = service.current();
        assertThat(snapshot.getVersion()).isEqualTo("builtin");
        assertThat(snapshot.getStoreStatistics().getBudgetMax()).isEqualTo(50.0);
        assertThat(snapshot.getStrategies()).hasSize(1);
    }

    @Test
    void failedReloadKeepsPreviousSnapshot() {
        SearchConfigLoader loader = mock(SearchConfigLoader.class);
        SearchConfigSnapshot first = snapshot("v1");
        SearchConfigSnapshot second = snapshot("v2");
        when(loader.load("classpath:search-config.yml"))
            .thenReturn(first)
            .thenThrow(new SearchConfigException("search config is not valid yaml"))
            .thenReturn(second);

        SearchConfigService service = new SearchConfigService(loader, new SearchConfigProperties());
        service.init();
        assertThat(service.current()).isSameAs(first);

        assertThat(service.reload()).isFalse();
        assertThat(service.current()).isSameAs(first);

        assertThat(service.reload()).isTrue();
        assertThat(service.current()).isSameAs(second);
    }

    private SearchConfigSnapshot snapshot(String version) {
        return new SearchConfigSnapshot(
            version,
            new CategoryPriceBand("store", 40.0, 120.0, List.of()),
            Map.of(),
            Map.of(),
            List.of(),
            List.of(),
            List.of()
        );
    }
}
