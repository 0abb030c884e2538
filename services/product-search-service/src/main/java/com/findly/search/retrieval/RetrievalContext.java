package com.findly.search.retrieval;

import java.util.concurrent.TimeUnit;

/**
 * Request ids plus the deadline shared by every embedding and store call of one search.
 */
public class RetrievalContext {
    private final String traceId;
    private final String requestId;
    private final Long deadlineNanos;

    private RetrievalContext(String traceId, String requestId, Long deadlineNanos) {
        this.traceId = traceId;
        this.requestId = requestId;
        this.deadlineNanos = deadlineNanos;
    }

    public static RetrievalContext withDeadline(String traceId, String requestId, long startedNanos, long budgetMs) {
        return new RetrievalContext(traceId, requestId, startedNanos + TimeUnit.MILLISECONDS.toNanos(Math.max(1L, budgetMs)));
    }

    public static RetrievalContext unbounded(String traceId, String requestId) {
        return new RetrievalContext(traceId, requestId, null);
    }

    public String getTraceId() {
        return traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    /**
     * Milliseconds left before the deadline, at least 1, or null when the request has no deadline.
     */
    public Integer remainingBudgetMs() {
        if (deadlineNanos == null) {
            return null;
        }
        long remaining = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, remaining));
    }
}
