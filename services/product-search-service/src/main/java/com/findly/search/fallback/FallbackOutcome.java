package com.findly.search.fallback;

import com.findly.search.retrieval.RetrievalResult;
import java.util.List;

public class FallbackOutcome {
    private final RetrievalResult result;
    private final boolean fallbackUsed;
    private final String message;
    private final int fallbackQueries;
    private final List<FallbackState> path;

    public FallbackOutcome(RetrievalResult result, boolean fallbackUsed, String message, int fallbackQueries, List<FallbackState> path) {
        this.result = result;
        this.fallbackUsed = fallbackUsed;
        this.message = message;
        this.fallbackQueries = fallbackQueries;
        this.path = List.copyOf(path);
    }

    public RetrievalResult getResult() {
        return result;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    /**
     * Present exactly when the fallback ran.
     */
    public String getMessage() {
        return message;
    }

    public int getFallbackQueries() {
        return fallbackQueries;
    }

    /**
     * States visited, starting with FILTERED and ending with DONE.
     */
    public List<FallbackState> getPath() {
        return path;
    }
}
