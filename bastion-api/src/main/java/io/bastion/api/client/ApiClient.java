package io.bastion.api.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.bastion.api.response.ApiResponse;

import java.time.Duration;
import java.util.Map;

/**
 * Client for a single upstream HTTP service.
 * <p>
 * Every call is guarded by the upstream's circuit breaker and the per-endpoint rate
 * limiter, runs on a pooled session, and is retried on transient failures.
 * <p>
 * Usage:
 * <pre>{@code
 * ApiResponse<JsonNode> servers = client.get("servers", Map.of("active", "true"));
 * client.post("orders", Map.of("plan", "monthly"));
 * }</pre>
 * Failures are thrown as {@link io.bastion.api.error.ApiException} subclasses.
 */
public interface ApiClient {

    /**
     * Perform a request.
     *
     * @param method  HTTP method
     * @param path    path relative to the upstream's base URL
     * @param body    payload serialized as JSON, or null
     * @param params  query parameters, or null
     * @param headers extra headers for this call, or null
     * @param timeout per-call timeout, or null for the configured default
     * @return the normalized response
     * @throws io.bastion.api.error.ApiException if the call failed
     */
    ApiResponse<JsonNode> request(String method, String path, Object body,
                                  Map<String, String> params, Map<String, String> headers,
                                  Duration timeout);

    default ApiResponse<JsonNode> request(String method, String path, Object body, Map<String, String> params) {
        return request(method, path, body, params, null, null);
    }

    default ApiResponse<JsonNode> get(String path) {
        return request("GET", path, null, null);
    }

    default ApiResponse<JsonNode> get(String path, Map<String, String> params) {
        return request("GET", path, null, params);
    }

    default ApiResponse<JsonNode> post(String path, Object body) {
        return request("POST", path, body, null);
    }

    default ApiResponse<JsonNode> put(String path, Object body) {
        return request("PUT", path, body, null);
    }

    default ApiResponse<JsonNode> delete(String path) {
        return request("DELETE", path, null, null);
    }
}
