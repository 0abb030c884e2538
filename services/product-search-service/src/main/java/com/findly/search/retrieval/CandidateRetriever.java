package com.findly.search.retrieval;

import com.findly.search.config.CategoryPriceBand;
import com.findly.search.config.SearchConfigService;
import com.findly.search.config.SearchConfigSnapshot;
import com.findly.search.embed.EmbeddingProvider;
import com.findly.search.embed.EmbeddingUnavailableException;
import com.findly.search.opensearch.OpenSearchGateway;
import com.findly.search.opensearch.OpenSearchProperties;
import com.findly.search.opensearch.OpenSearchRequestException;
import com.findly.search.opensearch.OpenSearchUnavailableException;
import com.findly.search.opensearch.ProductDocument;
import com.findly.search.opensearch.ProductQueryResult;
import com.findly.search.query.CleanedQuery;
import com.findly.search.resilience.CircuitBreaker;
import com.findly.search.resilience.SearchResilienceRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Embeds the cleaned query and runs the similarity query against the product store. Infrastructure
 * failures surface as {@link RetrievalException}; they are never reported as an empty result.
 */
@Component
public class CandidateRetriever {
    private static final Logger logger = LoggerFactory.getLogger(CandidateRetriever.class);

    private final EmbeddingProvider embeddingProvider;
    private final OpenSearchGateway openSearchGateway;
    private final OpenSearchProperties openSearchProperties;
    private final SearchResilienceRegistry resilienceRegistry;
    private final SearchConfigService configService;

    public CandidateRetriever(
        EmbeddingProvider embeddingProvider,
        OpenSearchGateway openSearchGateway,
        OpenSearchProperties openSearchProperties,
        SearchResilienceRegistry resilienceRegistry,
        SearchConfigService configService
    ) {
        this.embeddingProvider = embeddingProvider;
        this.openSearchGateway = openSearchGateway;
        this.openSearchProperties = openSearchProperties;
        this.resilienceRegistry = resilienceRegistry;
        this.configService = configService;
    }

    public List<Double> embed(CleanedQuery query, RetrievalContext context) {
        try {
            return embeddingProvider.embed(query.getText(), context.remainingBudgetMs(), context.getTraceId(), context.getRequestId());
        } catch (EmbeddingUnavailableException e) {
            logger.warn("embedding failed reason={} request_id={}", e.getMessage(), context.getRequestId());
            throw new RetrievalException(RetrievalException.Reason.EMBEDDING_FAILED, e.getMessage(), e);
        }
    }

    /**
     * One page of nearest neighbours with the price range pushed into the store query.
     */
    public RetrievalResult search(List<Double> vector, PriceRange range, int page, int limit, RetrievalContext context) {
        int from = (Math.max(1, page) - 1) * limit;
        ProductQueryResult result = callStore(() ->
            openSearchGateway.searchByVector(vector, range.getMin(), range.getMax(), from, limit, context.remainingBudgetMs())
        );
        List<CandidateResult> candidates = toCandidates(result.getDocuments());
        candidates.sort(RankingMode.SIMILARITY.comparator());
        return new RetrievalResult(candidates, result.getTotalHits());
    }

    /**
     * Nearest neighbours without any price predicate, ranked cheapest first. The total is the size of
     * the neighbour pool, which is bounded by {@code opensearch.fallback-candidates}.
     */
    public RetrievalResult searchCheapest(List<Double> vector, int page, int limit, RetrievalContext context) {
        int depth = Math.max(openSearchProperties.getFallbackCandidates(), Math.max(1, page) * limit);
        ProductQueryResult result = callStore(() ->
            openSearchGateway.searchCheapestNeighbours(vector, depth, context.remainingBudgetMs())
        );
        List<CandidateResult> pool = toCandidates(result.getDocuments());
        pool.sort(RankingMode.PRICE_ASCENDING.comparator());
        int from = Math.min(pool.size(), (Math.max(1, page) - 1) * limit);
        int to = Math.min(pool.size(), from + limit);
        return new RetrievalResult(pool.subList(from, to), pool.size());
    }

    private ProductQueryResult callStore(StoreCall call) {
        CircuitBreaker breaker = resilienceRegistry.getStoreBreaker();
        if (!breaker.allowRequest()) {
            throw new RetrievalException(RetrievalException.Reason.STORE_FAILED, "store_circuit_open", null);
        }
        try {
            ProductQueryResult result = call.execute();
            breaker.recordSuccess();
            return result;
        } catch (OpenSearchUnavailableException e) {
            breaker.recordFailure();
            logger.warn("store query failed reason=unavailable message={}", e.getMessage());
            throw new RetrievalException(RetrievalException.Reason.STORE_FAILED, e.getMessage(), e);
        } catch (OpenSearchRequestException e) {
            logger.warn("store query failed reason=request message={}", e.getMessage());
            throw new RetrievalException(RetrievalException.Reason.STORE_FAILED, e.getMessage(), e);
        }
    }

    private List<CandidateResult> toCandidates(List<ProductDocument> documents) {
        SearchConfigSnapshot config = configService.current();
        List<CandidateResult> candidates = new ArrayList<>(documents.size());
        for (ProductDocument doc : documents) {
            candidates.add(new CandidateResult(
                doc.getProductId(),
                doc.getTitle(),
                doc.getPrice(),
                doc.getTags(),
                resolveCategory(doc, config),
                doc.getScore() == null ? 0.0 : doc.getScore()
            ));
        }
        return candidates;
    }

    private String resolveCategory(ProductDocument doc, SearchConfigSnapshot config) {
        if (doc.getCategory() != null && !doc.getCategory().isBlank()) {
            return doc.getCategory();
        }
        Optional<CategoryPriceBand> inferred = config.detectCategory(String.join(" ", doc.getTags()) + " " + doc.getTitle());
        return inferred.map(CategoryPriceBand::getCategory).orElse(null);
    }

    @FunctionalInterface
    private interface StoreCall {
        ProductQueryResult execute();
    }
}
