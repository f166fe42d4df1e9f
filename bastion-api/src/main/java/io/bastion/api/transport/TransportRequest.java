package io.bastion.api.transport;

import java.time.Duration;
import java.util.Map;

/**
 * A single HTTP exchange to be sent on a {@link TransportSession}.
 *
 * @param method  upper-case HTTP method
 * @param url     absolute URL without query string
 * @param headers per-call headers, merged over the session defaults
 * @param body    request body, or null
 * @param params  query parameters, appended to the URL by the transport
 * @param timeout bound on the whole exchange
 */
public record TransportRequest(
        String method,
        String url,
        Map<String, String> headers,
        String body,
        Map<String, String> params,
        Duration timeout
) {

    public TransportRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("Method must not be blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL must not be blank");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
