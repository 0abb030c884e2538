package com.findly.search.service;

import com.findly.search.adaptive.AdaptiveContext;
import com.findly.search.adaptive.AdaptiveFilterEngine;
import com.findly.search.adaptive.AdaptiveOutcome;
import com.findly.search.adaptive.AdaptiveRequery;
import com.findly.search.analytics.AnalyticsRecorder;
import com.findly.search.analytics.SearchAnalyticsEvent;
import com.findly.search.api.dto.Pagination;
import com.findly.search.api.dto.PriceFilter;
import com.findly.search.api.dto.ProductHit;
import com.findly.search.api.dto.SearchResponse;
import com.findly.search.cache.CacheEndpointClass;
import com.findly.search.cache.ResultCacheService;
import com.findly.search.execution.SearchExecutionProperties;
import com.findly.search.fallback.FallbackOutcome;
import com.findly.search.fallback.FallbackResolver;
import com.findly.search.price.PriceIntent;
import com.findly.search.price.PriceIntentExtractor;
import com.findly.search.price.PriceLabelFormatter;
import com.findly.search.query.CleanedQuery;
import com.findly.search.query.QueryNormalizer;
import com.findly.search.query.TargetLanguage;
import com.findly.search.retrieval.CandidateResult;
import com.findly.search.retrieval.CandidateRetriever;
import com.findly.search.retrieval.PriceRange;
import com.findly.search.retrieval.RetrievalContext;
import com.findly.search.retrieval.RetrievalResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the search pipeline: price intent, normalization, cache lookup, embedding, filtered retrieval,
 * fallback, adaptive broadening, cache store. Stages run strictly in that order on one worker thread
 * under a global deadline; work finished after the deadline is dropped and never cached.
 */
@Service
public class ProductSearchService {
    private static final Logger logger = LoggerFactory.getLogger(ProductSearchService.class);

    private final PriceIntentExtractor priceIntentExtractor;
    private final QueryNormalizer queryNormalizer;
    private final ResultCacheService resultCache;
    private final CandidateRetriever candidateRetriever;
    private final FallbackResolver fallbackResolver;
    private final AdaptiveFilterEngine adaptiveFilterEngine;
    private final AnalyticsRecorder analyticsRecorder;
    private final SearchProperties searchProperties;
    private final SearchExecutionProperties executionProperties;
    private final ExecutorService searchExecutor;

    public ProductSearchService(
        PriceIntentExtractor priceIntentExtractor,
        QueryNormalizer queryNormalizer,
        ResultCacheService resultCache,
        CandidateRetriever candidateRetriever,
        FallbackResolver fallbackResolver,
        AdaptiveFilterEngine adaptiveFilterEngine,
        AnalyticsRecorder analyticsRecorder,
        SearchProperties searchProperties,
        SearchExecutionProperties executionProperties,
        @Qualifier("searchExecutor") ExecutorService searchExecutor
    ) {
        this.priceIntentExtractor = priceIntentExtractor;
        this.queryNormalizer = queryNormalizer;
        this.resultCache = resultCache;
        this.candidateRetriever = candidateRetriever;
        this.fallbackResolver = fallbackResolver;
        this.adaptiveFilterEngine = adaptiveFilterEngine;
        this.analyticsRecorder = analyticsRecorder;
        this.searchProperties = searchProperties;
        this.executionProperties = executionProperties;
        this.searchExecutor = searchExecutor;
    }

    public SearchResponse search(SearchCommand command) {
        validate(command);
        long started = System.nanoTime();
        AtomicBoolean cancelled = new AtomicBoolean(false);
        Future<SearchResponse> future;
        try {
            future = searchExecutor.submit(() -> runPipeline(command, started, cancelled));
        } catch (RejectedExecutionException e) {
            logger.warn("search rejected, executor saturated request_id={}", command.getRequestId());
            throw new SearchOverloadedException("search queue full", e);
        }
        SearchResponse response = await(future, cancelled, command);
        analyticsRecorder.record(snapshot(command, response));
        return response;
    }

    private SearchResponse await(Future<SearchResponse> future, AtomicBoolean cancelled, SearchCommand command) {
        long timeoutMs = Math.max(1L, executionProperties.getRequestTimeoutMs());
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancelled.set(true);
            future.cancel(true);
            logger.warn("search timed out timeout_ms={} request_id={}", timeoutMs, command.getRequestId());
            throw new SearchTimeoutException("search exceeded " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            cancelled.set(true);
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SearchTimeoutException("search interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("search pipeline failed", cause);
        }
    }

    SearchResponse runPipeline(SearchCommand command, long started, AtomicBoolean cancelled) {
        String rawQuery = command.getRawQuery().trim();
        PriceIntent intent = priceIntentExtractor.extract(rawQuery);
        CleanedQuery cleaned = queryNormalizer.clean(rawQuery, intent);
        TargetLanguage language = command.getTargetLanguage();

        String cacheKey = resultCache.aiSearchKey(
            cleaned.getText(),
            intent.getMinPrice(),
            intent.getMaxPrice(),
            command.getPage(),
            command.getLimit(),
            language.code()
        );
        Optional<SearchResponse> cached = resultCache.get(cacheKey, SearchResponse.class);
        if (cached.isPresent()) {
            return copyForHit(cached.get(), command, rawQuery, elapsedMs(started));
        }

        checkCancelled(cancelled);
        RetrievalContext retrieval = RetrievalContext.withDeadline(
            command.getTraceId(),
            command.getRequestId(),
            started,
            executionProperties.getRequestTimeoutMs()
        );
        List<Double> vector = candidateRetriever.embed(cleaned, retrieval);
        PriceRange range = PriceRange.of(intent.getMinPrice(), intent.getMaxPrice());
        RetrievalResult filtered = candidateRetriever.search(vector, range, command.getPage(), command.getLimit(), retrieval);

        checkCancelled(cancelled);
        FallbackOutcome fallback = fallbackResolver.resolve(
            filtered,
            range.isBounded(),
            () -> candidateRetriever.searchCheapest(vector, command.getPage(), command.getLimit(), retrieval),
            language
        );

        checkCancelled(cancelled);
        RetrievalResult finalResult = fallback.getResult();
        List<String> appliedStrategies = List.of();
        PriceRange effectiveRange = range;
        if (!fallback.isFallbackUsed() && !finalResult.isEmpty()) {
            AdaptiveRequery requery = (text, requeryRange) -> {
                List<Double> requeryVector = text.equals(cleaned.getText())
                    ? vector
                    : candidateRetriever.embed(new CleanedQuery(text), retrieval);
                return candidateRetriever.search(requeryVector, requeryRange, command.getPage(), command.getLimit(), retrieval);
            };
            AdaptiveOutcome adaptive = adaptiveFilterEngine.apply(
                new AdaptiveContext(cleaned.getText(), range, finalResult),
                requery
            );
            finalResult = adaptive.getResult();
            appliedStrategies = adaptive.getAppliedStrategies();
            effectiveRange = adaptive.getEffectiveRange();
        }

        SearchResponse response = buildResponse(
            command, rawQuery, cleaned, intent, range, effectiveRange, fallback, finalResult, appliedStrategies);
        response.setTookMs(elapsedMs(started));

        if (cancelled.get()) {
            logger.debug("search finished after deadline, response discarded request_id={}", command.getRequestId());
            return response;
        }
        if (!finalResult.getCandidates().isEmpty()) {
            resultCache.put(cacheKey, response, CacheEndpointClass.AI_SEARCH);
        }
        return response;
    }

    private SearchResponse buildResponse(
        SearchCommand command,
        String rawQuery,
        CleanedQuery cleaned,
        PriceIntent intent,
        PriceRange range,
        PriceRange effectiveRange,
        FallbackOutcome fallback,
        RetrievalResult result,
        List<String> appliedStrategies
    ) {
        List<ProductHit> hits = new ArrayList<>(result.getCandidates().size());
        for (CandidateResult candidate : result.getCandidates()) {
            hits.add(toHit(candidate));
        }

        // Bounds are the ones the returned page was filtered with, which differ from the intent once broadened.
        PriceFilter priceFilter = new PriceFilter();
        priceFilter.setMinPrice(effectiveRange.getMin());
        priceFilter.setMaxPrice(effectiveRange.getMax());
        priceFilter.setApplied(range.isBounded());
        priceFilter.setBroadened(!effectiveRange.equals(range));
        priceFilter.setFallbackUsed(fallback.isFallbackUsed());
        priceFilter.setSource(intent.getSource() == null ? null : intent.getSource().getWireName());
        priceFilter.setConfidence(intent.getConfidence());
        priceFilter.setLabel(PriceLabelFormatter.format(effectiveRange.getMin(), effectiveRange.getMax(), command.getTargetLanguage()));

        SearchResponse response = new SearchResponse();
        response.setTraceId(command.getTraceId());
        response.setRequestId(command.getRequestId());
        response.setQuery(rawQuery);
        response.setCleanedQuery(cleaned.getText());
        response.setResults(hits);
        response.setTotalCount(result.getTotalCount());
        response.setCount(hits.size());
        response.setPage(command.getPage());
        response.setLimit(command.getLimit());
        response.setPagination(Pagination.of(command.getPage(), command.getLimit(), result.getTotalCount()));
        response.setPriceFilter(priceFilter);
        response.setMessage(fallback.getMessage());
        response.setCacheHit(false);
        response.setAppliedStrategies(List.copyOf(appliedStrategies));
        return response;
    }

    static ProductHit toHit(CandidateResult candidate) {
        ProductHit hit = new ProductHit();
        hit.setProductId(candidate.getProductId());
        hit.setTitle(candidate.getTitle());
        hit.setPrice(candidate.getPrice());
        hit.setTags(candidate.getTags());
        hit.setSimilarity(candidate.getSimilarity());
        return hit;
    }

    private SearchResponse copyForHit(SearchResponse cached, SearchCommand command, String rawQuery, long tookMs) {
        SearchResponse copy = new SearchResponse();
        copy.setTraceId(command.getTraceId());
        copy.setRequestId(command.getRequestId());
        copy.setTookMs(tookMs);
        copy.setQuery(rawQuery);
        copy.setCleanedQuery(cached.getCleanedQuery());
        copy.setResults(cached.getResults() == null ? List.of() : List.copyOf(cached.getResults()));
        copy.setTotalCount(cached.getTotalCount());
        copy.setCount(cached.getCount());
        copy.setPage(cached.getPage());
        copy.setLimit(cached.getLimit());
        copy.setPagination(cached.getPagination());
        copy.setPriceFilter(cached.getPriceFilter());
        copy.setMessage(cached.getMessage());
        copy.setCacheHit(true);
        copy.setAppliedStrategies(cached.getAppliedStrategies());
        return copy;
    }

    private SearchAnalyticsEvent snapshot(SearchCommand command, SearchResponse response) {
        PriceFilter filter = response.getPriceFilter();
        return new SearchAnalyticsEvent(
            command.getRequestId(),
            command.getRawQuery(),
            filter == null ? null : filter.getMinPrice(),
            filter == null ? null : filter.getMaxPrice(),
            filter == null ? null : filter.getSource(),
            response.getCount(),
            response.getTotalCount(),
            response.getTookMs(),
            response.isCacheHit(),
            filter != null && filter.isFallbackUsed(),
            response.getAppliedStrategies(),
            Instant.now()
        );
    }

    private void validate(SearchCommand command) {
        if (command == null || command.getRawQuery() == null || command.getRawQuery().isBlank()) {
            throw new InvalidSearchRequestException("query is required");
        }
        if (command.getRawQuery().length() > searchProperties.getMaxQueryLength()) {
            throw new InvalidSearchRequestException("query must be at most " + searchProperties.getMaxQueryLength() + " characters");
        }
        if (command.getPage() < 1) {
            throw new InvalidSearchRequestException("page must be >= 1");
        }
        if (command.getLimit() < 1 || command.getLimit() > searchProperties.getMaxLimit()) {
            throw new InvalidSearchRequestException("limit must be between 1 and " + searchProperties.getMaxLimit());
        }
        if (command.getTargetLanguage() == null) {
            throw new InvalidSearchRequestException("target_language is not supported");
        }
    }

    private void checkCancelled(AtomicBoolean cancelled) {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw new SearchTimeoutException("search cancelled");
        }
    }

    private long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
