package com.findly.search.retrieval;

import java.util.Collections;
import java.util.List;

public class RetrievalResult {
    private final List<CandidateResult> candidates;
    private final long totalCount;

    public RetrievalResult(List<CandidateResult> candidates, long totalCount) {
        this.candidates = candidates == null ? Collections.emptyList() : List.copyOf(candidates);
        this.totalCount = Math.max(totalCount, this.candidates.size());
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), 0);
    }

    public List<CandidateResult> getCandidates() {
        return candidates;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public boolean isEmpty() {
        return totalCount == 0;
    }
}
