package com.findly.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.findly.search.api.ErrorCode;

/**
 * Error envelope shared by every endpoint: {@code {error:{code,message}, trace_id, request_id}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private Error error;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public ErrorResponse() {
    }

    public static ErrorResponse of(ErrorCode code, String message, String traceId, String requestId) {
        ErrorResponse response = new ErrorResponse();
        response.setError(new Error(code.getCode(), message));
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        return response;
    }

    public Error getError() {
        return error;
    }

    public void setError(Error error) {
        this.error = error;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public static class Error {
        private String code;
        private String message;

        public Error() {
        }

        public Error(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }
}
