package com.findly.search.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.findly.search.config.SearchConfigLoader;
import com.findly.search.config.SearchConfigService;
import com.findly.search.embed.EmbeddingProvider;
import com.findly.search.embed.EmbeddingUnavailableException;
import com.findly.search.opensearch.OpenSearchGateway;
import com.findly.search.opensearch.OpenSearchProperties;
import com.findly.search.opensearch.OpenSearchUnavailableException;
import com.findly.search.opensearch.ProductDocument;
import com.findly.search.opensearch.ProductQueryResult;
import com.findly.search.query.CleanedQuery;
import com.findly.search.resilience.SearchResilienceProperties;
import com.findly.search.resilience.SearchResilienceRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CandidateRetrieverTest {

    private static final List<Double> VECTOR = List.of(0.1, 0.2, 0.3);
    private static final RetrievalContext NO_DEADLINE = RetrievalContext.unbounded("t", "r");

    private EmbeddingProvider embeddingProvider;
    private OpenSearchGateway gateway;
    private OpenSearchProperties openSearchProperties;
    private CandidateRetriever retriever;

    @BeforeEach
    void setUp() {
        embeddingProvider = mock(EmbeddingProvider.class);
        gateway = mock(OpenSearchGateway.class);
        openSearchProperties = new OpenSearchProperties();
        openSearchProperties.setFallbackCandidates(5);
        SearchConfigService configService = mock(SearchConfigService.class);
        when(configService.current()).thenReturn(new SearchConfigLoader().load("classpath:search-config.yml"));
        retriever = new CandidateRetriever(
            embeddingProvider,
            gateway,
            openSearchProperties,
            new SearchResilienceRegistry(new SearchResilienceProperties()),
            configService
        );
    }

    @Test
    void embeddingFailureIsReportedAsRetrievalError() {
        when(embeddingProvider.embed(eq("schoenen"), any(), any(), any()))
            .thenThrow(new EmbeddingUnavailableException("embed_timeout"));

        assertThatThrownBy(() -> retriever.embed(new CleanedQuery("schoenen"), NO_DEADLINE))
            .isInstanceOf(RetrievalException.class)
            .satisfies(e -> assertThat(((RetrievalException) e).getReason()).isEqualTo(RetrievalException.Reason.EMBEDDING_FAILED));
    }

    @Test
    void searchPushesRangeAndRanksBySimilarity() {
        when(gateway.searchByVector(anyList(), any(), any(), anyInt(), anyInt(), any())).thenReturn(result(
            List.of(
                doc("p1", 40.0, 0.70, null, List.of("sneakers")),
                doc("p2", 30.0, 0.90, "shoes", List.of()),
                doc("p3", 20.0, 0.70, "coats", List.of())
            ),
            42
        ));

        RetrievalResult result = retriever.search(VECTOR, PriceRange.of(null, 50.0), 2, 25, NO_DEADLINE);

        verify(gateway).searchByVector(eq(VECTOR), isNull(), eq(50.0), eq(25), eq(25), isNull());
        assertThat(result.getTotalCount()).isEqualTo(42L);
        assertThat(result.getCandidates()).extracting(CandidateResult::getProductId).containsExactly("p2", "p3", "p1");
        assertThat(result.getCandidates().get(2).getCategory()).isEqualTo("shoes");
    }

    @Test
    void remainingBudgetIsPassedToEmbeddingAndStore() {
        RetrievalContext context = RetrievalContext.withDeadline("t", "r", System.nanoTime(), 5000);
        when(embeddingProvider.embed(eq("jas"), any(), any(), any())).thenReturn(VECTOR);
        when(gateway.searchByVector(anyList(), any(), any(), anyInt(), anyInt(), any()))
            .thenReturn(result(List.of(doc("p1", 90.0, 0.8, "coats", List.of())), 1));

        List<Double> vector = retriever.embed(new CleanedQuery("jas"), context);
        RetrievalResult result = retriever.search(vector, PriceRange.of(50.0, 100.0), 1, 10, context);

        verify(embeddingProvider).embed(eq("jas"), argThat(budget -> budget != null && budget > 0 && budget <= 5000), eq("t"), eq("r"));
        verify(gateway).searchByVector(
            eq(VECTOR), eq(50.0), eq(100.0), eq(0), eq(10), argThat(budget -> budget != null && budget > 0 && budget <= 5000));
        assertThat(result.getCandidates()).hasSize(1);
    }

    @Test
    void cheapestNeighboursAreSortedAndPaginated() {
        when(gateway.searchCheapestNeighbours(anyList(), anyInt(), any())).thenReturn(result(
            List.of(
                doc("a", 80.0, 0.9, null, List.of()),
                doc("b", 60.0, 0.5, null, List.of()),
                doc("c", 60.0, 0.8, null, List.of()),
                doc("d", 100.0, 0.4, null, List.of()),
                doc("e", 70.0, 0.3, null, List.of())
            ),
            5000
        ));

        RetrievalResult firstPage = retriever.searchCheapest(VECTOR, 1, 2, NO_DEADLINE);
        RetrievalResult thirdPage = retriever.searchCheapest(VECTOR, 3, 2, NO_DEADLINE);

        assertThat(firstPage.getCandidates()).extracting(CandidateResult::getProductId).containsExactly("c", "b");
        assertThat(firstPage.getTotalCount()).isEqualTo(5L);
        assertThat(thirdPage.getCandidates()).extracting(CandidateResult::getProductId).containsExactly("d");
        verify(gateway).searchCheapestNeighbours(eq(VECTOR), eq(5), isNull());
        verify(gateway).searchCheapestNeighbours(eq(VECTOR), eq(6), isNull());
    }

    @Test
    void storeOutageOpensBreaker() {
        when(gateway.searchByVector(anyList(), any(), any(), anyInt(), anyInt(), any()))
            .thenThrow(new OpenSearchUnavailableException("OpenSearch unavailable: 503", null));

        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> retriever.search(VECTOR, PriceRange.unbounded(), 1, 10, NO_DEADLINE))
                .isInstanceOf(RetrievalException.class);
        }
        assertThatThrownBy(() -> retriever.search(VECTOR, PriceRange.unbounded(), 1, 10, NO_DEADLINE))
            .isInstanceOf(RetrievalException.class)
            .hasMessage("store_circuit_open");

        verify(gateway, times(5)).searchByVector(anyList(), any(), any(), anyInt(), anyInt(), any());
    }

    private static ProductDocument doc(String id, double price, double score, String category, List<String> tags) {
        return new ProductDocument(id, "Product " + id, price, tags, category, score);
    }

    private static ProductQueryResult result(List<ProductDocument> documents, long total) {
        return new ProductQueryResult(documents, total, Map.of());
    }
}
