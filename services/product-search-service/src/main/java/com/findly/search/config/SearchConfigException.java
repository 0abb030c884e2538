package com.findly.search.config;

public class SearchConfigException extends RuntimeException {
    public SearchConfigException(String message) {
        super(message);
    }

    public SearchConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
