package com.findly.search.embed;

import com.findly.search.resilience.CircuitBreaker;
import com.findly.search.resilience.SearchResilienceRegistry;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingService implements EmbeddingProvider {
    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final EmbeddingCacheService cacheService;
    private final SearchResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        EmbeddingCacheService cacheService,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.cacheService = cacheService;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public List<Double> embed(String text, Integer timeBudgetMs, String traceId, String requestId) {
        if (properties.getMode() == EmbeddingMode.TOY) {
            return cacheService.getOrCompute(text, () -> toyEmbedder.embed(text));
        }
        return cacheService.getOrCompute(text, () -> fetch(text, timeBudgetMs, traceId, requestId));
    }

    private List<Double> fetch(String text, Integer timeBudgetMs, String traceId, String requestId) {
        CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
        if (!breaker.allowRequest()) {
            throw new EmbeddingUnavailableException("embed_circuit_open");
        }
        try {
            List<Double> vector = embeddingGateway.embed(text, timeBudgetMs, traceId, requestId);
            breaker.recordSuccess();
            return vector;
        } catch (EmbeddingUnavailableException ex) {
            breaker.recordFailure();
            throw ex;
        }
    }
}
