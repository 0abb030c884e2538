package com.findly.search.api;

import org.springframework.http.HttpStatus;

/**
 * Wire error codes and the status each one is served with.
 */
public enum ErrorCode {
    BAD_REQUEST("bad_request", HttpStatus.BAD_REQUEST),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", HttpStatus.TOO_MANY_REQUESTS),
    EMBEDDING_UNAVAILABLE("embedding_unavailable", HttpStatus.SERVICE_UNAVAILABLE),
    STORE_UNAVAILABLE("store_unavailable", HttpStatus.SERVICE_UNAVAILABLE),
    SERVICE_OVERLOADED("service_overloaded", HttpStatus.SERVICE_UNAVAILABLE),
    SEARCH_TIMEOUT("search_timeout", HttpStatus.GATEWAY_TIMEOUT),
    INTERNAL_ERROR("internal_error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus status;

    ErrorCode(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
