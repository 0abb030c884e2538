package com.findly.search.opensearch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
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

@Component
public class OpenSearchGateway {
    private static final List<String> SOURCE_FIELDS = List.of("product_id", "title", "price", "tags", "category");
    private static final int MAX_EXPANSIONS = 50;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OpenSearchProperties properties;

    public OpenSearchGateway(
        @Qualifier("openSearchRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        OpenSearchProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * k-NN query over the product index. A price range, when given, is pushed into the knn
     * {@code filter} so that excluded products never enter the neighbour set and the reported total
     * only counts matching products.
     */
    public ProductQueryResult searchByVector(
        List<Double> vector,
        Double minPrice,
        Double maxPrice,
        int from,
        int size,
        Integer timeBudgetMs
    ) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("vector", vector);
        field.put("k", Math.max(from + size, properties.getKnnCandidates()));
        Map<String, Object> range = priceRange(minPrice, maxPrice);
        if (range != null) {
            field.put("filter", Map.of("bool", Map.of("filter", List.of(Map.of("range", Map.of("price", range))))));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", from);
        body.put("size", size);
        body.put("track_total_hits", true);
        body.put("_source", SOURCE_FIELDS);
        body.put("query", Map.of("knn", Map.of(properties.getVectorField(), field)));
        body.put("sort", List.of(
            Map.of("_score", Map.of("order", "desc")),
            Map.of("price", Map.of("order", "asc"))
        ));

        JsonNode response = postJson("/" + properties.getProductIndex() + "/_search", body, timeBudgetMs);
        return toResult(response, body);
    }

    /**
     * Unfiltered nearest neighbours ordered cheapest first, used when a price filter matched nothing.
     */
    public ProductQueryResult searchCheapestNeighbours(List<Double> vector, int depth, Integer timeBudgetMs) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("vector", vector);
        field.put("k", Math.max(1, depth));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", Math.max(1, depth));
        body.put("track_total_hits", true);
        body.put("_source", SOURCE_FIELDS);
        body.put("query", Map.of("knn", Map.of(properties.getVectorField(), field)));
        body.put("sort", List.of(
            Map.of("price", Map.of("order", "asc")),
            Map.of("_score", Map.of("order", "desc"))
        ));

        JsonNode response = postJson("/" + properties.getProductIndex() + "/_search", body, timeBudgetMs);
        return toResult(response, body);
    }

    public ProductQueryResult listProducts(int from, int size, String sortField, String sortOrder) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", from);
        body.put("size", size);
        body.put("track_total_hits", true);
        body.put("_source", SOURCE_FIELDS);
        body.put("query", Map.of("match_all", Map.of()));
        body.put("sort", List.of(
            Map.of(sortField, Map.of("order", sortOrder)),
            Map.of("product_id", Map.of("order", "asc"))
        ));

        JsonNode response = postJson("/" + properties.getProductIndex() + "/_search", body, null);
        return toResult(response, body);
    }

    /**
     * Titles starting with the typed text, with a plain all-terms match as the fallback clause.
     */
    public ProductQueryResult suggestTitles(String prefix, int size) {
        Map<String, Object> phrasePrefix = new LinkedHashMap<>();
        phrasePrefix.put("query", prefix);
        phrasePrefix.put("max_expansions", MAX_EXPANSIONS);

        Map<String, Object> allTerms = new LinkedHashMap<>();
        allTerms.put("query", prefix);
        allTerms.put("operator", "and");

        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("should", List.of(
            Map.of("match_phrase_prefix", Map.of("title", phrasePrefix)),
            Map.of("match", Map.of("title", allTerms))
        ));
        bool.put("minimum_should_match", 1);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", Math.max(1, size));
        body.put("_source", SOURCE_FIELDS);
        body.put("query", Map.of("bool", bool));

        JsonNode response = postJson("/" + properties.getProductIndex() + "/_search", body, null);
        return toResult(response, body);
    }

    private Map<String, Object> priceRange(Double minPrice, Double maxPrice) {
        if (minPrice == null && maxPrice == null) {
            return null;
        }
        Map<String, Object> range = new LinkedHashMap<>();
        if (minPrice != null) {
            range.put("gte", minPrice);
        }
        if (maxPrice != null) {
            range.put("lte", maxPrice);
        }
        return range;
    }

    private ProductQueryResult toResult(JsonNode response, Map<String, Object> body) {
        List<ProductDocument> documents = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            JsonNode source = hit.path("_source");
            String productId = source.path("product_id").asText(null);
            if (productId == null || productId.isEmpty()) {
                productId = hit.path("_id").asText(null);
            }
            if (productId == null) {
                continue;
            }
            List<String> tags = new ArrayList<>();
            for (JsonNode tag : source.path("tags")) {
                if (tag.isTextual() && !tag.asText().isBlank()) {
                    tags.add(tag.asText());
                }
            }
            JsonNode scoreNode = hit.path("_score");
            Double score = scoreNode.isNumber() ? scoreNode.asDouble() : null;
            documents.add(new ProductDocument(
                productId,
                source.path("title").asText(""),
                source.path("price").asDouble(0.0),
                tags,
                source.path("category").asText(null),
                score
            ));
        }
        JsonNode total = response.path("hits").path("total");
        long totalHits = total.isNumber() ? total.asLong() : total.path("value").asLong(documents.size());
        return new ProductQueryResult(documents, totalHits, body);
    }

    private JsonNode postJson(String path, Object body, Integer timeBudgetMs) {
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new OpenSearchUnavailableException("OpenSearch base url not configured", null);
        }
        String url = buildUrl(path);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            String payload = objectMapper.writeValueAsString(body);
            HttpEntity<String> entity = new HttpEntity<>(payload, headers);
            RestTemplate client = restTemplateFor(timeBudgetMs);
            ResponseEntity<String> response = client.exchange(url, HttpMethod.POST, entity, String.class);
            return objectMapper.readTree(response.getBody());
        } catch (ResourceAccessException e) {
            throw new OpenSearchUnavailableException("OpenSearch unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 502 || status == 503 || status == 504) {
                throw new OpenSearchUnavailableException("OpenSearch unavailable: " + status, e);
            }
            throw new OpenSearchRequestException("OpenSearch error: " + status, e);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to parse OpenSearch response", e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    /**
     * The shared client unless the remaining request budget is tighter than its read timeout.
     */
    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null || timeBudgetMs >= properties.getReadTimeoutMs()) {
            return restTemplate;
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Math.min(timeBudgetMs, properties.getConnectTimeoutMs()));
        factory.setReadTimeout(timeBudgetMs);
        RestTemplate client = new RestTemplate(factory);
        client.setInterceptors(restTemplate.getInterceptors());
        return client;
    }
}
