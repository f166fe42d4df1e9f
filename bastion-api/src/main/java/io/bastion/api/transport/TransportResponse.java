package io.bastion.api.transport;

import java.util.Map;
import java.util.Optional;

/**
 * Raw outcome of an exchange, before classification.
 */
public record TransportResponse(int statusCode, Map<String, String> headers, String body) {

    public TransportResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
    }

    /**
     * Case-insensitive header lookup.
     */
    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public boolean hasBody() {
        return !body.isEmpty();
    }
}
