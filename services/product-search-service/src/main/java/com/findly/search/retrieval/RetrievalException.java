package com.findly.search.retrieval;

/**
 * An infrastructure failure during retrieval. Distinct from an empty result: callers must not treat
 * it as "no products matched".
 */
public class RetrievalException extends RuntimeException {
    public enum Reason {
        EMBEDDING_FAILED,
        STORE_FAILED
    }

    private final Reason reason;

    public RetrievalException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
