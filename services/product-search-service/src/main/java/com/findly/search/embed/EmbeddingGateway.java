package com.findly.search.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for an OpenAI-compatible {@code /v1/embeddings} endpoint.
 */
@Component
public class EmbeddingGateway {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingGateway.class);

    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
        EmbeddingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public List<Double> embed(String text, Integer timeBudgetMs, String traceId, String requestId) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        EmbeddingRequest request = new EmbeddingRequest();
        request.setModel(properties.getModel());
        request.setInput(List.of(text));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }
        if (traceId != null && !traceId.isBlank()) {
            headers.add("x-trace-id", traceId);
        }
        if (requestId != null && !requestId.isBlank()) {
            headers.add("x-request-id", requestId);
        }
        HttpEntity<EmbeddingRequest> entity = new HttpEntity<>(request, headers);

        int retries = Math.max(0, properties.getRetryCount());
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                RestTemplate client = restTemplateFor(timeBudgetMs);
                ResponseEntity<EmbeddingResponse> response = client.exchange(
                    buildUrl("/v1/embeddings"),
                    HttpMethod.POST,
                    entity,
                    EmbeddingResponse.class
                );
                return extractVector(response.getBody());
            } catch (ResourceAccessException e) {
                String reason = e.getCause() instanceof SocketTimeoutException ? "embed_timeout" : "embed_unavailable";
                if (attempt >= retries) {
                    throw new EmbeddingUnavailableException(reason, e);
                }
                logger.debug("embedding attempt failed attempt={} reason={}", attempt + 1, reason);
            } catch (HttpStatusCodeException e) {
                String reason = "embed_http_" + e.getStatusCode().value();
                if (attempt >= retries || e.getStatusCode().is4xxClientError()) {
                    throw new EmbeddingUnavailableException(reason, e);
                }
                logger.debug("embedding attempt failed attempt={} reason={}", attempt + 1, reason);
            }
            backoff(attempt);
        }
        throw new EmbeddingUnavailableException("embed_unavailable");
    }

    private List<Double> extractVector(EmbeddingResponse body) {
        if (body == null || body.getData() == null || body.getData().isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        List<Double> vector = body.getData().get(0).getEmbedding();
        if (vector == null || vector.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_vector");
        }
        if (properties.getDimension() > 0 && vector.size() != properties.getDimension()) {
            throw new EmbeddingUnavailableException("embed_dimension_mismatch");
        }
        return vector;
    }

    private void backoff(int attempt) {
        long delayMs = properties.getRetryBackoffMs() * (attempt + 1L);
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("embed_interrupted", e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null || timeBudgetMs >= properties.getTimeoutMs()) {
            return restTemplate;
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeBudgetMs);
        factory.setReadTimeout(timeBudgetMs);
        RestTemplate client = new RestTemplate(factory);
        client.setInterceptors(restTemplate.getInterceptors());
        return client;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingRequest {
        private String model;
        private List<String> input;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getInput() {
            return input;
        }

        public void setInput(List<String> input) {
            this.input = input;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingResponse {
        private String model;
        private List<EmbeddingData> data;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<EmbeddingData> getData() {
            return data;
        }

        public void setData(List<EmbeddingData> data) {
            this.data = data;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingData {
        private Integer index;
        private List<Double> embedding;

        public Integer getIndex() {
            return index;
        }

        public void setIndex(Integer index) {
            this.index = index;
        }

        public List<Double> getEmbedding() {
            return embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }
    }
}
