package io.bastion.api.error;

/**
 * Classes of failure a request can end in.
 * Only {@link #SERVER} and {@link #RATE_LIMIT} are transient enough to be retried.
 */
public enum ErrorCode {
    UNKNOWN("unknown_error"),
    NETWORK("network_error"),
    TIMEOUT("timeout_error"),
    AUTH("authentication_error"),
    RATE_LIMIT("rate_limit_error"),
    SERVER("server_error"),
    CLIENT("client_error"),
    VALIDATION("validation_error"),
    NOT_FOUND("not_found_error"),
    CACHE("cache_error");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isRetryable() {
        return this == SERVER || this == RATE_LIMIT;
    }
}
