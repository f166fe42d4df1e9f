package io.bastion.core.transport;

import io.bastion.api.transport.Transport;
import io.bastion.api.transport.TransportRequest;
import io.bastion.api.transport.TransportResponse;
import io.bastion.api.transport.TransportSession;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Transport over {@link java.net.http.HttpClient}. Sessions share one client, which keeps
 * its own connection pool; a session only carries default headers.
 */
public class JdkHttpTransport implements Transport {

    private final HttpClient httpClient;

    public JdkHttpTransport(Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public TransportSession openSession() {
        return new Session();
    }

    @Override
    public void close() {
        // HttpClient has no close() before JDK 21; its threads are released with the client
    }

    static URI buildUri(String url, Map<String, String> params) {
        if (params.isEmpty()) {
            return URI.create(url);
        }
        String query = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        return URI.create(url + (url.contains("?") ? "&" : "?") + query);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private class Session implements TransportSession {

        private final Map<String, String> headers = new LinkedHashMap<>();

        @Override
        public void header(String name, String value) {
            headers.put(name, value);
        }

        @Override
        public Map<String, String> headers() {
            return Collections.unmodifiableMap(headers);
        }

        @Override
        public TransportResponse send(TransportRequest request) throws IOException, InterruptedException {
            HttpRequest.BodyPublisher publisher = request.body() == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8);

            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(buildUri(request.url(), request.params()))
                    .timeout(request.timeout())
                    .method(request.method(), publisher);

            Map<String, String> merged = new LinkedHashMap<>(headers);
            merged.putAll(request.headers());
            merged.forEach(builder::header);

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

            Map<String, String> responseHeaders = new LinkedHashMap<>();
            response.headers().map().forEach((name, values) -> {
                List<String> nonEmpty = values == null ? List.of() : values;
                if (!nonEmpty.isEmpty()) {
                    responseHeaders.put(name, nonEmpty.get(0));
                }
            });
            return new TransportResponse(response.statusCode(), responseHeaders, response.body());
        }

        @Override
        public void close() {
            headers.clear();
        }
    }
}
