package io.bastion.api.response;

import java.time.Instant;

/**
 * Normalized result of a successful call. Created fresh per call and never mutated.
 *
 * @param success    always true for responses handed to callers; failures surface as exceptions
 * @param data       decoded body, or null for an empty body
 * @param error      upstream error message when one accompanied the response
 * @param statusCode HTTP status, or null when served from cache
 * @param cached     whether the data came from the response cache
 * @param timestamp  when this response was produced
 */
public record ApiResponse<T>(
        boolean success,
        T data,
        String error,
        Integer statusCode,
        boolean cached,
        Instant timestamp
) {

    public static <T> ApiResponse<T> ok(T data, int statusCode, Instant timestamp) {
        return new ApiResponse<>(true, data, null, statusCode, false, timestamp);
    }

    public static <T> ApiResponse<T> fromCache(T data, Instant timestamp) {
        return new ApiResponse<>(true, data, null, null, true, timestamp);
    }
}
