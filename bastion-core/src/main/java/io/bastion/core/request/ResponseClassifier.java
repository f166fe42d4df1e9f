package io.bastion.core.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bastion.api.error.*;
import io.bastion.api.response.ApiResponse;
import io.bastion.api.transport.TransportResponse;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps raw transport outcomes onto {@link ApiResponse} or a typed {@link ApiException}.
 * <pre>
 * 401          AuthenticationException
 * 429          RateLimitException, Retry-After header or 60s
 * 5xx          ServerException
 * 404          NotFoundException, resource.type / resource.id from the body
 * 422          ValidationException, errors / message from the body
 * other 4xx    ClientException
 * </pre>
 */
public class ResponseClassifier {

    static final long DEFAULT_RETRY_AFTER_SECONDS = 60;

    private final ObjectMapper mapper;
    private final Clock clock;

    public ResponseClassifier(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    public ApiResponse<JsonNode> classify(TransportResponse response) {
        int status = response.statusCode();
        if (status >= 400) {
            throw classifyError(response);
        }
        if (!response.hasBody()) {
            return ApiResponse.ok(null, status, clock.instant());
        }
        try {
            return ApiResponse.ok(mapper.readTree(response.body()), status, clock.instant());
        } catch (JsonProcessingException e) {
            throw new ClientException("Invalid JSON response", status, e);
        }
    }

    /**
     * Classify a failure that happened before any response arrived.
     */
    public ApiException classifyTransportFailure(IOException e) {
        if (e instanceof HttpTimeoutException || e instanceof SocketTimeoutException) {
            return new ApiException("Request timed out: " + e.getMessage(), ErrorCode.TIMEOUT, e);
        }
        return new ApiException("Network error: " + e.getMessage(), ErrorCode.NETWORK, e);
    }

    private ApiException classifyError(TransportResponse response) {
        int status = response.statusCode();
        JsonNode body = errorBody(response);

        if (status == 401) {
            return new AuthenticationException("Authentication failed", status, body);
        }
        if (status == 429) {
            return new RateLimitException("Rate limit exceeded", status, body, retryAfter(response));
        }
        if (status >= 500) {
            return new ServerException("Server error occurred", status, body);
        }
        if (status == 404) {
            JsonNode resource = body.path("resource");
            return new NotFoundException(
                    body.path("message").asText("Resource not found"),
                    resource.path("type").asText("unknown"),
                    resource.hasNonNull("id") ? resource.get("id").asText() : null);
        }
        if (status == 422) {
            return new ValidationException(
                    body.path("message").asText("Validation failed"),
                    fieldErrors(body.path("errors")),
                    status);
        }
        return new ClientException(body.path("message").asText("Request failed"), status, body);
    }

    // non-JSON error bodies are wrapped as {"message": <text>}
    private JsonNode errorBody(TransportResponse response) {
        JsonNode parsed = null;
        if (response.hasBody()) {
            try {
                parsed = mapper.readTree(response.body());
            } catch (JsonProcessingException e) {
                parsed = null;
            }
        }
        if (parsed != null && parsed.isObject()) {
            return parsed;
        }
        ObjectNode fallback = mapper.createObjectNode();
        if (response.hasBody()) {
            fallback.put("message", response.body());
        }
        return fallback;
    }

    private static long retryAfter(TransportResponse response) {
        return response.header("Retry-After")
                .map(String::trim)
                .map(value -> {
                    try {
                        return Long.parseLong(value);
                    } catch (NumberFormatException e) {
                        return DEFAULT_RETRY_AFTER_SECONDS;
                    }
                })
                .orElse(DEFAULT_RETRY_AFTER_SECONDS);
    }

    private static Map<String, List<String>> fieldErrors(JsonNode errors) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (!errors.isObject()) {
            return result;
        }
        errors.fields().forEachRemaining(field -> {
            List<String> messages = new ArrayList<>();
            if (field.getValue().isArray()) {
                field.getValue().forEach(m -> messages.add(m.asText()));
            } else {
                messages.add(field.getValue().asText());
            }
            result.put(field.getKey(), messages);
        });
        return result;
    }
}
