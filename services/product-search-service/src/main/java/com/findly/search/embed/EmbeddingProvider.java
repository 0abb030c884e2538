package com.findly.search.embed;

import java.util.List;

public interface EmbeddingProvider {
    /**
     * @throws EmbeddingUnavailableException when no vector could be produced within the budget
     */
    List<Double> embed(String text, Integer timeBudgetMs, String traceId, String requestId);
}
