package com.findly.search.opensearch;

public class OpenSearchRequestException extends RuntimeException {
    public OpenSearchRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
