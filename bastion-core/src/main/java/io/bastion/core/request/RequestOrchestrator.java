package io.bastion.core.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bastion.api.client.ApiClient;
import io.bastion.api.config.ClientConfig;
import io.bastion.api.error.ApiException;
import io.bastion.api.error.ClientException;
import io.bastion.api.error.ErrorCode;
import io.bastion.api.error.RateLimitException;
import io.bastion.api.error.ServerException;
import io.bastion.api.metrics.MetricsManager;
import io.bastion.api.pool.ConnectionPool;
import io.bastion.api.response.ApiResponse;
import io.bastion.api.status.Severity;
import io.bastion.api.transport.TransportRequest;
import io.bastion.api.transport.TransportResponse;
import io.bastion.api.transport.TransportSession;
import io.bastion.core.breaker.CircuitBreaker;
import io.bastion.core.diagnostics.Diagnostics;
import io.bastion.core.ratelimit.RateDecision;
import io.bastion.core.ratelimit.SlidingWindowRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Request entry point for one upstream.
 * <p>
 * Each attempt runs circuit check, rate check, session acquire, execute, classify,
 * telemetry and breaker update, and always returns the session to the pool. The whole
 * attempt is wrapped by a {@link RetryExecutor}. Circuit and rate rejections fail before
 * any network call is made.
 */
public class RequestOrchestrator implements ApiClient {

    private static final Logger log = LoggerFactory.getLogger(RequestOrchestrator.class);

    public static final String API_LATENCY = "api_latency";
    public static final String API_ERRORS = "api_errors";
    public static final String RATE_LIMITS = "rate_limits";

    private final String upstream;
    private final String baseUrl;
    private final ClientConfig config;
    private final ConnectionPool pool;
    private final SlidingWindowRateLimiter limiter;
    private final CircuitBreaker breaker;
    private final MetricsManager metrics;
    private final Diagnostics diagnostics;
    private final ObjectMapper mapper;
    private final ResponseClassifier classifier;
    private final RetryExecutor retry;
    private final Clock clock;

    public RequestOrchestrator(String upstream,
                               String baseUrl,
                               ClientConfig config,
                               ConnectionPool pool,
                               SlidingWindowRateLimiter limiter,
                               CircuitBreaker breaker,
                               MetricsManager metrics,
                               Diagnostics diagnostics,
                               ObjectMapper mapper,
                               RetryExecutor retry) {
        this.upstream = upstream;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.config = config;
        this.pool = pool;
        this.limiter = limiter;
        this.breaker = breaker;
        this.metrics = metrics;
        this.diagnostics = diagnostics;
        this.mapper = mapper;
        this.clock = config.clock();
        this.classifier = new ResponseClassifier(mapper, clock);
        this.retry = retry;
    }

    @Override
    public ApiResponse<JsonNode> request(String method, String path, Object body,
                                         Map<String, String> params, Map<String, String> headers,
                                         Duration timeout) {
        String verb = method.toUpperCase(Locale.ROOT);
        String endpoint = path.startsWith("/") ? path.substring(1) : path;
        String payload = serialize(body);
        return retry.execute(() -> attempt(verb, endpoint, payload, params, headers, timeout));
    }

    private ApiResponse<JsonNode> attempt(String method, String endpoint, String payload,
                                          Map<String, String> params, Map<String, String> headers,
                                          Duration timeout) {
        checkCircuit();
        checkRate(endpoint);

        TransportSession session = pool.acquire(config.poolAcquireTimeout());
        Instant start = clock.instant();
        try {
            if (config.authToken() != null) {
                session.header("Authorization", "Bearer " + config.authToken());
            }
            TransportRequest request = new TransportRequest(
                    method,
                    baseUrl + "/" + endpoint,
                    headers,
                    payload,
                    params,
                    timeout != null ? timeout : config.timeout());

            TransportResponse response = send(session, request, endpoint, start);
            Duration duration = Duration.between(start, clock.instant());
            recordLatency(method, endpoint, String.valueOf(response.statusCode()), duration);

            if (duration.compareTo(config.slowRequestThreshold()) > 0) {
                diagnostics.recordSlowRequest(endpoint, duration, Map.of(
                        "method", method,
                        "status", response.statusCode(),
                        "size", response.body().length()));
            }

            ApiResponse<JsonNode> result = classifier.classify(response);
            breaker.recordSuccess();
            log.debug("{} {} -> {} in {}ms", method, endpoint, response.statusCode(), duration.toMillis());
            return result;
        } catch (ApiException e) {
            recordFailure(endpoint, e);
            throw e;
        } finally {
            pool.release(session);
        }
    }

    private TransportResponse send(TransportSession session, TransportRequest request,
                                   String endpoint, Instant start) {
        try {
            return session.send(request);
        } catch (IOException e) {
            recordLatency(request.method(), endpoint, "error", Duration.between(start, clock.instant()));
            diagnostics.recordConnectionIssue(baseUrl, e, Map.of("endpoint", endpoint));
            throw classifier.classifyTransportFailure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException("Request interrupted", ErrorCode.UNKNOWN, e);
        } catch (RuntimeException e) {
            recordLatency(request.method(), endpoint, "error", Duration.between(start, clock.instant()));
            throw new ApiException("Unexpected error: " + e.getMessage(), ErrorCode.UNKNOWN, e);
        }
    }

    private void checkCircuit() {
        if (!breaker.allowRequest()) {
            ObjectNode body = mapper.createObjectNode();
            body.put("service", upstream);
            throw new ServerException("Circuit breaker open for " + upstream, 503, body);
        }
    }

    private void checkRate(String endpoint) {
        // one window per upstream and endpoint
        RateDecision decision = limiter.isAllowed(upstream + ":" + endpoint);
        if (decision.allowed()) {
            return;
        }
        long retryAfter = decision.retryAfterSeconds().orElse(1);
        metrics.record(RATE_LIMITS, 1, Map.of("endpoint", endpoint));
        diagnostics.recordIssue("rate_limit", Severity.WARNING,
                "Rate limit exceeded for " + endpoint,
                Map.of("retry_after", retryAfter));

        ObjectNode body = mapper.createObjectNode();
        body.put("message", "Too many requests");
        throw new RateLimitException("Rate limit exceeded", 429, body, retryAfter);
    }

    private void recordLatency(String method, String endpoint, String status, Duration duration) {
        metrics.record(API_LATENCY, duration.toNanos() / 1_000_000_000.0, Map.of(
                "method", method,
                "endpoint", endpoint,
                "status", status));
    }

    private void recordFailure(String endpoint, ApiException e) {
        metrics.record(API_ERRORS, 1, Map.of("endpoint", endpoint, "error_code", e.errorCode().value()));
        breaker.recordFailure();

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("endpoint", endpoint);
        context.put(Diagnostics.ERROR_TYPE, e.getClass().getSimpleName());
        context.put("error", String.valueOf(e.getMessage()));
        e.statusCode().ifPresent(status -> context.put("status_code", status));
        diagnostics.recordIssue("api", Severity.ERROR, "API request failed: " + e.getMessage(), context);
        log.debug("Request to {} failed: {}", endpoint, e.getMessage());
    }

    private String serialize(Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof String) {
            return (String) body;
        }
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ClientException("Request body is not serializable: " + e.getOriginalMessage(), null, e);
        }
    }

    public String upstream() {
        return upstream;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public CircuitBreaker breaker() {
        return breaker;
    }
}
