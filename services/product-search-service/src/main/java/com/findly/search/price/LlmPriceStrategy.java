package com.findly.search.price;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.findly.search.config.CategoryPriceBand;
import com.findly.search.config.SearchConfigSnapshot;
import com.findly.search.llm.LlmGateway;
import com.findly.search.llm.LlmProperties;
import com.findly.search.llm.LlmUnavailableException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Asks the LLM for a price range when the deterministic strategies were not confident. The call is
 * bounded by {@code llm.timeout-ms} and the worker is interrupted on timeout. A timeout, a full
 * executor queue or an unusable answer yields nothing.
 */
@Component
public class LlmPriceStrategy {
    private static final Logger log = LoggerFactory.getLogger(LlmPriceStrategy.class);
    private static final String SYSTEM_PROMPT = "Price analysis expert. Return valid JSON only.";

    private final LlmGateway llmGateway;
    private final LlmProperties llmProperties;
    private final PriceIntentProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService auxiliaryExecutor;

    public LlmPriceStrategy(
        LlmGateway llmGateway,
        LlmProperties llmProperties,
        PriceIntentProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("auxiliaryExecutor") ExecutorService auxiliaryExecutor
    ) {
        this.llmGateway = llmGateway;
        this.llmProperties = llmProperties;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.auxiliaryExecutor = auxiliaryExecutor;
    }

    public boolean isAvailable() {
        return properties.isLlmEnabled() && llmGateway.isConfigured();
    }

    public Optional<PriceSignal> infer(String rawQuery, SearchConfigSnapshot config) {
        if (!isAvailable() || rawQuery == null || rawQuery.isBlank()) {
            return Optional.empty();
        }
        String prompt = buildPrompt(rawQuery, config.getStoreStatistics());
        Future<String> call;
        try {
            call = auxiliaryExecutor.submit(() -> llmGateway.complete(SYSTEM_PROMPT, prompt));
        } catch (RejectedExecutionException e) {
            log.warn("llm price inference skipped, executor saturated query={}", PriceIntentExtractor.truncate(rawQuery));
            return Optional.empty();
        }
        String content;
        try {
            content = call.get(Math.max(1, llmProperties.getTimeoutMs()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("llm price inference timed out timeout_ms={} query={}", llmProperties.getTimeoutMs(), PriceIntentExtractor.truncate(rawQuery));
            return Optional.empty();
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            String reason = cause instanceof LlmUnavailableException ? cause.getMessage() : cause.getClass().getSimpleName();
            log.warn("llm price inference failed reason={} query={}", reason, PriceIntentExtractor.truncate(rawQuery));
            return Optional.empty();
        }
        return parse(content, rawQuery);
    }

    Optional<PriceSignal> parse(String content, String rawQuery) {
        if (content == null || content.isBlank()) {
            log.warn("llm price inference empty query={}", PriceIntentExtractor.truncate(rawQuery));
            return Optional.empty();
        }
        String json = stripCodeFence(content.trim());
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("llm price inference malformed query={}", PriceIntentExtractor.truncate(rawQuery));
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("llm price inference malformed query={}", PriceIntentExtractor.truncate(rawQuery));
            return Optional.empty();
        }
        Double min = positiveNumber(node.get("min_price"));
        Double max = positiveNumber(node.get("max_price"));
        if (min == null && max == null) {
            return Optional.empty();
        }
        if (min != null && max != null && min > max) {
            double swap = min;
            min = max;
            max = swap;
        }
        return Optional.of(new PriceSignal(min, max, properties.getLlmConfidence(), PriceIntentSource.LLM_INFERENCE, List.of()));
    }

    private String buildPrompt(String rawQuery, CategoryPriceBand store) {
        String query = rawQuery.length() > 100 ? rawQuery.substring(0, 100) : rawQuery;
        return String.format(
            Locale.ROOT,
            "Analyze: '%s'%nStore context: budget=€%.0f, premium=€%.0f%n"
                + "Return JSON: {\"min_price\": <number|null>, \"max_price\": <number|null>}",
            query,
            store.getBudgetMax(),
            store.getPremiumMin()
        );
    }

    private String stripCodeFence(String content) {
        if (!content.startsWith("```")) {
            return content;
        }
        int firstNewline = content.indexOf('\n');
        int lastFence = content.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return content;
        }
        return content.substring(firstNewline + 1, lastFence).trim();
    }

    private Double positiveNumber(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim().replace(',', '.'));
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return value > 0 && Double.isFinite(value) ? value : null;
    }
}
