package com.findly.search.opensearch;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class ProductQueryResult {
    private final List<ProductDocument> documents;
    private final long totalHits;
    private final Map<String, Object> queryDsl;

    public ProductQueryResult(List<ProductDocument> documents, long totalHits, Map<String, Object> queryDsl) {
        this.documents = documents == null ? Collections.emptyList() : documents;
        this.totalHits = totalHits;
        this.queryDsl = queryDsl;
    }

    public List<ProductDocument> getDocuments() {
        return documents;
    }

    public long getTotalHits() {
        return totalHits;
    }

    public Map<String, Object> getQueryDsl() {
        return queryDsl;
    }
}
