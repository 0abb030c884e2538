package com.findly.search.service;

import com.findly.search.api.dto.Pagination;
import com.findly.search.api.dto.ProductHit;
import com.findly.search.api.dto.ProductListResponse;
import com.findly.search.cache.CacheEndpointClass;
import com.findly.search.cache.ResultCacheService;
import com.findly.search.opensearch.OpenSearchGateway;
import com.findly.search.opensearch.OpenSearchRequestException;
import com.findly.search.opensearch.OpenSearchUnavailableException;
import com.findly.search.opensearch.ProductDocument;
import com.findly.search.opensearch.ProductQueryResult;
import com.findly.search.resilience.CircuitBreaker;
import com.findly.search.resilience.SearchResilienceRegistry;
import com.findly.search.retrieval.RetrievalException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Plain catalog listing without a query. Cached under the listing TTL class.
 */
@Service
public class ProductListingService {
    private static final Map<String, String> SORT_FIELDS = Map.of(
        "price", "price",
        "title", "title.keyword",
        "id", "product_id"
    );

    private final OpenSearchGateway openSearchGateway;
    private final ResultCacheService resultCache;
    private final SearchResilienceRegistry resilienceRegistry;
    private final SearchProperties searchProperties;

    public ProductListingService(
        OpenSearchGateway openSearchGateway,
        ResultCacheService resultCache,
        SearchResilienceRegistry resilienceRegistry,
        SearchProperties searchProperties
    ) {
        this.openSearchGateway = openSearchGateway;
        this.resultCache = resultCache;
        this.resilienceRegistry = resilienceRegistry;
        this.searchProperties = searchProperties;
    }

    public ProductListResponse list(int page, int limit, String sortBy, String sortOrder, String traceId, String requestId) {
        String sortKey = sortBy == null ? "id" : sortBy.trim().toLowerCase(Locale.ROOT);
        String order = sortOrder == null ? "asc" : sortOrder.trim().toLowerCase(Locale.ROOT);
        if (page < 1) {
            throw new InvalidSearchRequestException("page must be >= 1");
        }
        if (limit < 1 || limit > searchProperties.getMaxListingLimit()) {
            throw new InvalidSearchRequestException("limit must be between 1 and " + searchProperties.getMaxListingLimit());
        }
        if (!SORT_FIELDS.containsKey(sortKey)) {
            throw new InvalidSearchRequestException("sort_by must be one of price, title, id");
        }
        if (!order.equals("asc") && !order.equals("desc")) {
            throw new InvalidSearchRequestException("sort_order must be asc or desc");
        }

        String cacheKey = resultCache.listingKey(page, limit, sortKey, order);
        Optional<ProductListResponse> cached = resultCache.get(cacheKey, ProductListResponse.class);
        if (cached.isPresent()) {
            return copyForHit(cached.get(), traceId, requestId);
        }

        ProductQueryResult result = fetch(page, limit, SORT_FIELDS.get(sortKey), order);
        List<ProductHit> products = new ArrayList<>(result.getDocuments().size());
        for (ProductDocument doc : result.getDocuments()) {
            ProductHit hit = new ProductHit();
            hit.setProductId(doc.getProductId());
            hit.setTitle(doc.getTitle());
            hit.setPrice(doc.getPrice());
            hit.setTags(doc.getTags());
            products.add(hit);
        }

        ProductListResponse response = new ProductListResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setProducts(products);
        response.setTotalCount(result.getTotalHits());
        response.setSortBy(sortKey);
        response.setSortOrder(order);
        response.setPagination(Pagination.of(page, limit, result.getTotalHits()));
        response.setCacheHit(false);
        if (!products.isEmpty()) {
            resultCache.put(cacheKey, response, CacheEndpointClass.LISTING);
        }
        return response;
    }

    private ProductQueryResult fetch(int page, int limit, String sortField, String order) {
        CircuitBreaker breaker = resilienceRegistry.getStoreBreaker();
        if (!breaker.allowRequest()) {
            throw new RetrievalException(RetrievalException.Reason.STORE_FAILED, "store_circuit_open", null);
        }
        try {
            ProductQueryResult result = openSearchGateway.listProducts((page - 1) * limit, limit, sortField, order);
            breaker.recordSuccess();
            return result;
        } catch (OpenSearchUnavailableException e) {
            breaker.recordFailure();
            throw new RetrievalException(RetrievalException.Reason.STORE_FAILED, e.getMessage(), e);
        } catch (OpenSearchRequestException e) {
            throw new RetrievalException(RetrievalException.Reason.STORE_FAILED, e.getMessage(), e);
        }
    }

    private ProductListResponse copyForHit(ProductListResponse cached, String traceId, String requestId) {
        ProductListResponse copy = new ProductListResponse();
        copy.setTraceId(traceId);
        copy.setRequestId(requestId);
        copy.setProducts(cached.getProducts());
        copy.setTotalCount(cached.getTotalCount());
        copy.setSortBy(cached.getSortBy());
        copy.setSortOrder(cached.getSortOrder());
        copy.setPagination(cached.getPagination());
        copy.setCacheHit(true);
        return copy;
    }
}
