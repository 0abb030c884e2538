package com.findly.search.service;

public class SearchOverloadedException extends RuntimeException {
    public SearchOverloadedException(String message, Throwable cause) {
        super(message, cause);
    }
}
