package com.findly.search.embed;

/**
 * The embedding provider could not produce a vector. The message is a short reason code such as
 * {@code embed_timeout} or {@code embed_http_503}.
 */
public class EmbeddingUnavailableException extends RuntimeException {
    public EmbeddingUnavailableException(String reason) {
        super(reason);
    }

    public EmbeddingUnavailableException(String reason, Throwable cause) {
        super(reason, cause);
    }

    public boolean isTimeout() {
        return "embed_timeout".equals(getMessage());
    }
}
