package com.findly.search.api;

import com.findly.search.api.dto.ErrorResponse;
import com.findly.search.api.dto.ProductListResponse;
import com.findly.search.api.dto.SearchResponse;
import com.findly.search.cache.ResultCacheService;
import com.findly.search.query.TargetLanguage;
import com.findly.search.retrieval.RetrievalException;
import com.findly.search.service.AutocompleteService;
import com.findly.search.service.InvalidSearchRequestException;
import com.findly.search.service.ProductListingService;
import com.findly.search.service.ProductSearchService;
import com.findly.search.service.SearchCommand;
import com.findly.search.service.SearchOverloadedException;
import com.findly.search.service.SearchProperties;
import com.findly.search.service.SearchTimeoutException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestController
public class SearchController {
    private static final Logger logger = LoggerFactory.getLogger(SearchController.class);

    private final ProductSearchService searchService;
    private final ProductListingService listingService;
    private final AutocompleteService autocompleteService;
    private final ResultCacheService resultCache;
    private final SearchProperties searchProperties;

    public SearchController(
        ProductSearchService searchService,
        ProductListingService listingService,
        AutocompleteService autocompleteService,
        ResultCacheService resultCache,
        SearchProperties searchProperties
    ) {
        this.searchService = searchService;
        this.listingService = listingService;
        this.autocompleteService = autocompleteService;
        this.resultCache = resultCache;
        this.searchProperties = searchProperties;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/ai-search")
    public ResponseEntity<?> aiSearch(
        @RequestParam(value = "query", required = false) String query,
        @RequestParam(value = "page", defaultValue = "1") int page,
        @RequestParam(value = "limit", required = false) Integer limit,
        @RequestParam(value = "target_language", required = false) String targetLanguage,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader,
        @RequestHeader(value = "traceparent", required = false) String traceparent
    ) {
        String traceId = resolveTraceId(traceIdHeader, traceparent);
        String requestId = normalizeOrGenerate(requestIdHeader);

        TargetLanguage language = targetLanguage == null || targetLanguage.isBlank()
            ? searchProperties.getStoreLanguage()
            : TargetLanguage.fromCode(targetLanguage);
        if (language == null) {
            return error(ErrorCode.BAD_REQUEST, "target_language must be nl or en", traceId, requestId);
        }
        int effectiveLimit = limit == null ? searchProperties.getDefaultLimit() : limit;

        try {
            SearchResponse response = searchService.search(
                new SearchCommand(query, page, effectiveLimit, language, traceId, requestId)
            );
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            return error(ErrorCode.BAD_REQUEST, e.getMessage(), traceId, requestId);
        } catch (RetrievalException e) {
            return retrievalFailure(e, traceId, requestId);
        } catch (SearchOverloadedException e) {
            return error(ErrorCode.SERVICE_OVERLOADED, "Search capacity exhausted, retry shortly", traceId, requestId);
        } catch (SearchTimeoutException e) {
            logger.warn("search timed out request_id={} reason={}", requestId, e.getMessage());
            return error(ErrorCode.SEARCH_TIMEOUT, "Search took too long", traceId, requestId);
        } catch (Exception e) {
            logger.error("search failed request_id={}", requestId, e);
            return error(ErrorCode.INTERNAL_ERROR, "Unexpected error", traceId, requestId);
        }
    }

    @GetMapping("/products")
    public ResponseEntity<?> listProducts(
        @RequestParam(value = "page", defaultValue = "1") int page,
        @RequestParam(value = "limit", required = false) Integer limit,
        @RequestParam(value = "sort_by", defaultValue = "id") String sortBy,
        @RequestParam(value = "sort_order", defaultValue = "asc") String sortOrder,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = normalizeOrGenerate(traceIdHeader);
        String requestId = normalizeOrGenerate(requestIdHeader);
        int effectiveLimit = limit == null ? searchProperties.getDefaultLimit() : limit;
        try {
            ProductListResponse response = listingService.list(page, effectiveLimit, sortBy, sortOrder, traceId, requestId);
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            return error(ErrorCode.BAD_REQUEST, e.getMessage(), traceId, requestId);
        } catch (RetrievalException e) {
            return retrievalFailure(e, traceId, requestId);
        } catch (Exception e) {
            logger.error("product listing failed request_id={}", requestId, e);
            return error(ErrorCode.INTERNAL_ERROR, "Unexpected error", traceId, requestId);
        }
    }

    @GetMapping("/suggestions/autocomplete")
    public ResponseEntity<?> autocomplete(
        @RequestParam(value = "query", required = false) String query,
        @RequestParam(value = "limit", defaultValue = "10") int limit,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = normalizeOrGenerate(traceIdHeader);
        String requestId = normalizeOrGenerate(requestIdHeader);
        try {
            return ResponseEntity.ok(autocompleteService.suggest(query, limit, traceId, requestId));
        } catch (InvalidSearchRequestException e) {
            return error(ErrorCode.BAD_REQUEST, e.getMessage(), traceId, requestId);
        } catch (RetrievalException e) {
            return retrievalFailure(e, traceId, requestId);
        } catch (Exception e) {
            logger.error("autocomplete failed request_id={}", requestId, e);
            return error(ErrorCode.INTERNAL_ERROR, "Unexpected error", traceId, requestId);
        }
    }

    @GetMapping("/cache/stats")
    public ResultCacheService.CacheStats cacheStats() {
        return resultCache.stats();
    }

    @DeleteMapping("/cache")
    public Map<String, Object> clearCache() {
        return invalidated("cache_cleared", resultCache.invalidateAll());
    }

    @PostMapping("/internal/catalog/changed")
    public Map<String, Object> catalogChanged() {
        return invalidated("catalog_changed", resultCache.invalidateAll());
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e, HttpServletRequest request) {
        String traceId = normalizeOrGenerate(request.getHeader("x-trace-id"));
        String requestId = normalizeOrGenerate(request.getHeader("x-request-id"));
        String message = e instanceof MethodArgumentTypeMismatchException mismatch
            ? mismatch.getName() + " is invalid"
            : "invalid request parameters";
        return error(ErrorCode.BAD_REQUEST, message, traceId, requestId);
    }

    private ResponseEntity<ErrorResponse> retrievalFailure(RetrievalException e, String traceId, String requestId) {
        ErrorCode code = e.getReason() == RetrievalException.Reason.EMBEDDING_FAILED
            ? ErrorCode.EMBEDDING_UNAVAILABLE
            : ErrorCode.STORE_UNAVAILABLE;
        logger.warn("retrieval unavailable request_id={} code={} reason={}", requestId, code.getCode(), e.getMessage());
        return error(code, "Search is temporarily unavailable", traceId, requestId);
    }

    private ResponseEntity<ErrorResponse> error(ErrorCode code, String message, String traceId, String requestId) {
        return ResponseEntity.status(code.getStatus()).body(ErrorResponse.of(code, message, traceId, requestId));
    }

    private Map<String, Object> invalidated(String reason, long removed) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("reason", reason);
        body.put("removed", removed);
        return body;
    }

    private String resolveTraceId(String headerValue, String traceparent) {
        String normalized = normalize(headerValue);
        if (normalized != null) {
            return normalized;
        }
        String fromTraceparent = extractTraceId(traceparent);
        if (fromTraceparent != null) {
            return fromTraceparent;
        }
        return UUID.randomUUID().toString();
    }

    private String normalizeOrGenerate(String value) {
        String normalized = normalize(value);
        return normalized != null ? normalized : UUID.randomUUID().toString();
    }

    private String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private String extractTraceId(String traceparent) {
        if (traceparent == null) {
            return null;
        }
        String[] parts = traceparent.trim().split("-");
        if (parts.length < 4 || parts[1].length() != 32) {
            return null;
        }
        return parts[1];
    }
}
