package com.findly.search.service;

import com.findly.search.query.TargetLanguage;

/**
 * An accepted search request. Immutable.
 */
public final class SearchCommand {
    private final String rawQuery;
    private final int page;
    private final int limit;
    private final TargetLanguage targetLanguage;
    private final String traceId;
    private final String requestId;

    public SearchCommand(String rawQuery, int page, int limit, TargetLanguage targetLanguage, String traceId, String requestId) {
        this.rawQuery = rawQuery;
        this.page = page;
        this.limit = limit;
        this.targetLanguage = targetLanguage;
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public String getRawQuery() {
        return rawQuery;
    }

    public int getPage() {
        return page;
    }

    public int getLimit() {
        return limit;
    }

    public TargetLanguage getTargetLanguage() {
        return targetLanguage;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getRequestId() {
        return requestId;
    }
}
