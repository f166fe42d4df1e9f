package io.bastion.api.error;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raised when a request is refused for exceeding a rate limit, either by the local
 * limiter or by the upstream (HTTP 429).
 */
public final class RateLimitException extends ApiException {

    private final long retryAfterSeconds;

    public RateLimitException(String message, Integer statusCode, JsonNode response, long retryAfterSeconds) {
        super(message, ErrorCode.RATE_LIMIT, statusCode, response);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * @return seconds the caller should wait before trying again
     */
    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }
}
