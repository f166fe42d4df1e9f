package io.bastion.api.error;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Base exception for every failed request.
 * <p>
 * Carries the failure class, the HTTP status when the upstream answered, and the
 * upstream body when one could be read, so callers can choose their own remediation.
 */
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Integer statusCode;
    private final JsonNode response;

    public ApiException(String message, ErrorCode errorCode) {
        this(message, errorCode, null, null, null);
    }

    public ApiException(String message, ErrorCode errorCode, Throwable cause) {
        this(message, errorCode, null, null, cause);
    }

    public ApiException(String message, ErrorCode errorCode, Integer statusCode, JsonNode response) {
        this(message, errorCode, statusCode, response, null);
    }

    public ApiException(String message, ErrorCode errorCode, Integer statusCode, JsonNode response, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode == null ? ErrorCode.UNKNOWN : errorCode;
        this.statusCode = statusCode;
        this.response = response;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    public Optional<Integer> statusCode() {
        return Optional.ofNullable(statusCode);
    }

    public Optional<JsonNode> response() {
        return Optional.ofNullable(response);
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
