package io.bastion.api.config;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a client runtime.
 * Controls retries, timeouts, rate limiting, pooling, circuit breaking, caching and
 * the periodic background loops.
 * <p>
 * Every option has a default, so the smallest valid configuration is:
 * <pre>{@code
 * var config = ClientConfig.create("https://api.example.com");
 * }</pre>
 */
public final class ClientConfig {

    private final String baseUrl;
    private String authToken = null;
    private int maxRetries = 3;
    private Duration retryBaseDelay = Duration.ofSeconds(1);
    private Duration timeout = Duration.ofSeconds(30);
    private int rateLimitMaxRequests = 100;
    private Duration rateLimitWindow = Duration.ofSeconds(60);
    private int poolMaxSize = 10;
    private Duration poolAcquireTimeout = Duration.ofSeconds(30);
    private int failureThreshold = 5;
    private Duration recoveryTimeout = Duration.ofSeconds(60);
    private int halfOpenLimit = 3;
    private Duration slowRequestThreshold = Duration.ofSeconds(1);
    private Duration defaultCacheTtl = Duration.ofSeconds(300);
    private Duration localCacheTtlCap = Duration.ofSeconds(60);
    private Duration metricsRetention = Duration.ofHours(1);
    private Duration metricsCompactionInterval = Duration.ofMinutes(5);
    private Duration diagnosticsInterval = Duration.ofMinutes(5);
    private Duration monitoringInterval = Duration.ofSeconds(60);
    private Duration healthCacheTtl = Duration.ofSeconds(60);
    private String userAgent = "Bastion-Client/1.0";
    private String redisUri = null; // null = in-process shared tier
    private Clock clock = Clock.systemUTC();

    private ClientConfig(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL must not be blank");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static ClientConfig create(String baseUrl) {
        return new ClientConfig(baseUrl);
    }

    /**
     * Build a configuration from the process environment.
     * Reads {@code API_BASE_URL}, {@code API_AUTH_TOKEN}, {@code REDIS_HOST},
     * {@code REDIS_PORT} and {@code REDIS_DB}.
     */
    public static ClientConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static ClientConfig fromEnvironment(Map<String, String> env) {
        ClientConfig config = create(env.getOrDefault("API_BASE_URL", "http://localhost:8000"));
        String token = env.get("API_AUTH_TOKEN");
        if (token != null && !token.isBlank()) {
            config.authToken(token);
        }
        String redisHost = env.get("REDIS_HOST");
        if (redisHost != null && !redisHost.isBlank()) {
            String port = env.getOrDefault("REDIS_PORT", "6379");
            String db = env.getOrDefault("REDIS_DB", "0");
            config.redisUri("redis://" + redisHost + ":" + port + "/" + db);
        }
        return config;
    }

    public ClientConfig authToken(String authToken) {
        this.authToken = authToken;
        return this;
    }

    /**
     * Total number of attempts made by the retry wrapper, including the first one.
     */
    public ClientConfig maxRetries(int maxRetries) {
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("Max retries must be positive");
        }
        this.maxRetries = maxRetries;
        return this;
    }

    public ClientConfig retryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = requireNonNegative(retryBaseDelay, "Retry base delay");
        return this;
    }

    public ClientConfig timeout(Duration timeout) {
        this.timeout = requirePositive(timeout, "Timeout");
        return this;
    }

    public ClientConfig rateLimit(int maxRequests, Duration window) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("Rate limit max requests must be positive");
        }
        this.rateLimitMaxRequests = maxRequests;
        this.rateLimitWindow = requirePositive(window, "Rate limit window");
        return this;
    }

    public ClientConfig poolMaxSize(int poolMaxSize) {
        if (poolMaxSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive");
        }
        this.poolMaxSize = poolMaxSize;
        return this;
    }

    public ClientConfig poolAcquireTimeout(Duration poolAcquireTimeout) {
        this.poolAcquireTimeout = requireNonNegative(poolAcquireTimeout, "Pool acquire timeout");
        return this;
    }

    public ClientConfig failureThreshold(int failureThreshold) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("Failure threshold must be positive");
        }
        this.failureThreshold = failureThreshold;
        return this;
    }

    public ClientConfig recoveryTimeout(Duration recoveryTimeout) {
        this.recoveryTimeout = requireNonNegative(recoveryTimeout, "Recovery timeout");
        return this;
    }

    public ClientConfig halfOpenLimit(int halfOpenLimit) {
        if (halfOpenLimit <= 0) {
            throw new IllegalArgumentException("Half-open limit must be positive");
        }
        this.halfOpenLimit = halfOpenLimit;
        return this;
    }

    public ClientConfig slowRequestThreshold(Duration slowRequestThreshold) {
        this.slowRequestThreshold = requireNonNegative(slowRequestThreshold, "Slow request threshold");
        return this;
    }

    public ClientConfig defaultCacheTtl(Duration defaultCacheTtl) {
        this.defaultCacheTtl = requirePositive(defaultCacheTtl, "Default cache TTL");
        return this;
    }

    /**
     * Upper bound for entries in the process-local tier. The effective local TTL of a
     * key is always the smaller of this cap and the shared-tier TTL.
     */
    public ClientConfig localCacheTtlCap(Duration localCacheTtlCap) {
        this.localCacheTtlCap = requirePositive(localCacheTtlCap, "Local cache TTL cap");
        return this;
    }

    public ClientConfig metricsRetention(Duration metricsRetention) {
        this.metricsRetention = requirePositive(metricsRetention, "Metrics retention");
        return this;
    }

    public ClientConfig metricsCompactionInterval(Duration metricsCompactionInterval) {
        this.metricsCompactionInterval = requirePositive(metricsCompactionInterval, "Metrics compaction interval");
        return this;
    }

    public ClientConfig diagnosticsInterval(Duration diagnosticsInterval) {
        this.diagnosticsInterval = requirePositive(diagnosticsInterval, "Diagnostics interval");
        return this;
    }

    public ClientConfig monitoringInterval(Duration monitoringInterval) {
        this.monitoringInterval = requirePositive(monitoringInterval, "Monitoring interval");
        return this;
    }

    public ClientConfig healthCacheTtl(Duration healthCacheTtl) {
        this.healthCacheTtl = requireNonNegative(healthCacheTtl, "Health cache TTL");
        return this;
    }

    public ClientConfig userAgent(String userAgent) {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        return this;
    }

    /**
     * Use a Redis server as the shared cache tier, e.g. {@code redis://localhost:6379/0}.
     * If not set, an in-process shared tier is used.
     */
    public ClientConfig redisUri(String redisUri) {
        this.redisUri = redisUri;
        return this;
    }

    public ClientConfig clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    public String baseUrl() { return baseUrl; }
    public String authToken() { return authToken; }
    public int maxRetries() { return maxRetries; }
    public Duration retryBaseDelay() { return retryBaseDelay; }
    public Duration timeout() { return timeout; }
    public int rateLimitMaxRequests() { return rateLimitMaxRequests; }
    public Duration rateLimitWindow() { return rateLimitWindow; }
    public int poolMaxSize() { return poolMaxSize; }
    public Duration poolAcquireTimeout() { return poolAcquireTimeout; }
    public int failureThreshold() { return failureThreshold; }
    public Duration recoveryTimeout() { return recoveryTimeout; }
    public int halfOpenLimit() { return halfOpenLimit; }
    public Duration slowRequestThreshold() { return slowRequestThreshold; }
    public Duration defaultCacheTtl() { return defaultCacheTtl; }
    public Duration localCacheTtlCap() { return localCacheTtlCap; }
    public Duration metricsRetention() { return metricsRetention; }
    public Duration metricsCompactionInterval() { return metricsCompactionInterval; }
    public Duration diagnosticsInterval() { return diagnosticsInterval; }
    public Duration monitoringInterval() { return monitoringInterval; }
    public Duration healthCacheTtl() { return healthCacheTtl; }
    public String userAgent() { return userAgent; }
    public String redisUri() { return redisUri; }
    public Clock clock() { return clock; }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }
}
