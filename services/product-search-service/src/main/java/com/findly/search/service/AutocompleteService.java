package com.findly.search.service;

import com.findly.search.api.dto.AutocompleteResponse;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Title suggestions for a partially typed query, served from the product index and cached under the
 * short autocomplete TTL class.
 */
@Service
public class AutocompleteService {
    static final int MAX_LIMIT = 50;
    private static final int FETCH_MULTIPLIER = 3;
    private static final int MAX_QUERY_LENGTH = 100;

    private final OpenSearchGateway openSearchGateway;
    private final ResultCacheService resultCache;
    private final SearchResilienceRegistry resilienceRegistry;

    public AutocompleteService(
        OpenSearchGateway openSearchGateway,
        ResultCacheService resultCache,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.openSearchGateway = openSearchGateway;
        this.resultCache = resultCache;
        this.resilienceRegistry = resilienceRegistry;
    }

    public AutocompleteResponse suggest(String query, int limit, String traceId, String requestId) {
        long started = System.nanoTime();
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidSearchRequestException("query is required");
        }
        if (trimmed.length() > MAX_QUERY_LENGTH) {
            throw new InvalidSearchRequestException("query must be at most " + MAX_QUERY_LENGTH + " characters");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidSearchRequestException("limit must be between 1 and " + MAX_LIMIT);
        }

        String cacheKey = resultCache.autocompleteKey(trimmed, limit);
        Optional<AutocompleteResponse> cached = resultCache.get(cacheKey, AutocompleteResponse.class);
        if (cached.isPresent()) {
            AutocompleteResponse hit = cached.get();
            hit.setTraceId(traceId);
            hit.setRequestId(requestId);
            hit.setQuery(trimmed);
            hit.setTookMs(elapsedMs(started));
            hit.setCacheHit(true);
            return hit;
        }

        ProductQueryResult result = fetch(trimmed, Math.min(limit * FETCH_MULTIPLIER, MAX_LIMIT));
        List<AutocompleteResponse.Suggestion> suggestions = dedupeTitles(result.getDocuments(), limit);

        AutocompleteResponse response = new AutocompleteResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setQuery(trimmed);
        response.setSuggestions(suggestions);
        response.setCount(suggestions.size());
        response.setCacheHit(false);
        response.setTookMs(elapsedMs(started));
        if (!suggestions.isEmpty()) {
            resultCache.put(cacheKey, response, CacheEndpointClass.AUTOCOMPLETE);
        }
        return response;
    }

    /**
     * One suggestion per distinct title, compared case-insensitively, keeping the best scoring hit and
     * the store order of first appearance.
     */
    static List<AutocompleteResponse.Suggestion> dedupeTitles(List<ProductDocument> documents, int limit) {
        Map<String, ProductDocument> best = new LinkedHashMap<>();
        for (ProductDocument doc : documents) {
            if (doc.getTitle() == null || doc.getTitle().isBlank()) {
                continue;
            }
            String key = doc.getTitle().trim().toLowerCase(Locale.ROOT);
            ProductDocument existing = best.get(key);
            if (existing == null) {
                if (best.size() >= limit) {
                    continue;
                }
                best.put(key, doc);
            } else if (score(doc) > score(existing)) {
                best.put(key, doc);
            }
        }
        List<AutocompleteResponse.Suggestion> suggestions = new ArrayList<>(best.size());
        for (ProductDocument doc : best.values()) {
            AutocompleteResponse.Suggestion suggestion = new AutocompleteResponse.Suggestion();
            suggestion.setText(doc.getTitle().trim());
            suggestion.setProductId(doc.getProductId());
            suggestion.setScore(score(doc));
            suggestions.add(suggestion);
        }
        return suggestions;
    }

    private ProductQueryResult fetch(String prefix, int size) {
        CircuitBreaker breaker = resilienceRegistry.getStoreBreaker();
        if (!breaker.allowRequest()) {
            throw new RetrievalException(RetrievalException.Reason.STORE_FAILED, "store_circuit_open", null);
        }
        try {
            ProductQueryResult result = openSearchGateway.suggestTitles(prefix, size);
            breaker.recordSuccess();
            return result;
        } catch (OpenSearchUnavailableException e) {
            breaker.recordFailure();
            throw new RetrievalException(RetrievalException.Reason.STORE_FAILED, e.getMessage(), e);
        } catch (OpenSearchRequestException e) {
            throw new RetrievalException(RetrievalException.Reason.STORE_FAILED, e.getMessage(), e);
        }
    }

    private static double score(ProductDocument doc) {
        return doc.getScore() == null ? 0.0 : doc.getScore();
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
