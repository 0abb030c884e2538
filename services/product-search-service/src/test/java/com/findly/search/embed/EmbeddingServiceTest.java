package com.findly.search.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.findly.search.resilience.SearchResilienceProperties;
import com.findly.search.resilience.SearchResilienceRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmbeddingServiceTest {

    private EmbeddingProperties properties;
    private EmbeddingGateway gateway;
    private EmbeddingService service;

    @BeforeEach
    void setUp() {
        properties = new EmbeddingProperties();
        properties.setDimension(4);
        gateway = mock(EmbeddingGateway.class);
        service = new EmbeddingService(
            properties,
            gateway,
            new ToyEmbedder(properties),
            new EmbeddingCacheService(properties, new SimpleMeterRegistry()),
            new SearchResilienceRegistry(new SearchResilienceProperties())
        );
    }

    @Test
    void repeatedTextIsServedFromCache() {
        when(gateway.embed("rode jas", 500, "t", "r")).thenReturn(List.of(0.1, 0.2, 0.3, 0.4));

        List<Double> first = service.embed("rode jas", 500, "t", "r");
        List<Double> second = service.embed("Rode Jas", 500, "t", "r");

        assertThat(second).isEqualTo(first);
        verify(gateway, times(1)).embed(anyString(), any(), any(), any());
    }

    @Test
    void toyModeIsDeterministicAndUnitLength() {
        properties.setMode(EmbeddingMode.TOY);

        List<Double> a = service.embed("winterjas", null, null, null);
        List<Double> b = service.embed("winterjas", null, null, null);

        assertThat(a).hasSize(4).isEqualTo(b);
        double norm = Math.sqrt(a.stream().mapToDouble(v -> v * v).sum());
        assertThat(norm).isCloseTo(1.0, within(1e-9));
        verify(gateway, never()).embed(anyString(), any(), any(), any());
    }

    @Test
    void toyVectorsOfSharedWordsAreCloser() {
        properties.setMode(EmbeddingMode.TOY);
        properties.setDimension(64);

        List<Double> base = service.embed("zwarte leren laarzen", null, null, null);
        List<Double> related = service.embed("zwarte laarzen", null, null, null);
        List<Double> unrelated = service.embed("zomerse strohoed", null, null, null);

        assertThat(dot(base, related)).isGreaterThan(dot(base, unrelated));
    }

    private double dot(List<Double> a, List<Double> b) {
        double sum = 0.0;
        for (int i = 0; i < a.size(); i++) {
            sum += a.get(i) * b.get(i);
        }
        return sum;
    }

    @Test
    void breakerOpensAfterRepeatedFailures() {
        properties.getCache().setEnabled(false);
        when(gateway.embed(anyString(), any(), any(), any())).thenThrow(new EmbeddingUnavailableException("embed_timeout"));

        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> service.embed("jas", 100, null, null)).hasMessage("embed_timeout");
        }

        assertThatThrownBy(() -> service.embed("jas", 100, null, null)).hasMessage("embed_circuit_open");
        verify(gateway, times(5)).embed(anyString(), any(), any(), any());
    }
}
