package io.bastion.core.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.bastion.api.cache.SharedCacheBackend;
import io.bastion.api.client.ApiClient;
import io.bastion.api.config.ClientConfig;
import io.bastion.api.metrics.MetricStats;
import io.bastion.api.response.ApiResponse;
import io.bastion.api.status.ConnectionStats;
import io.bastion.api.status.RuntimeStatus;
import io.bastion.api.transport.Transport;
import io.bastion.core.breaker.BreakerRegistry;
import io.bastion.core.cache.CacheManager;
import io.bastion.core.cache.InMemorySharedCache;
import io.bastion.core.cache.LettuceSharedCache;
import io.bastion.core.diagnostics.Diagnostics;
import io.bastion.core.diagnostics.SystemMonitor;
import io.bastion.core.health.HealthCheck;
import io.bastion.core.health.HealthProbe;
import io.bastion.core.metrics.WindowedMetricsManager;
import io.bastion.core.pool.DefaultConnectionPool;
import io.bastion.core.ratelimit.SlidingWindowRateLimiter;
import io.bastion.core.request.RequestOrchestrator;
import io.bastion.core.request.RetryExecutor;
import io.bastion.core.transport.JdkHttpTransport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The client runtime. Constructed once at process start and shared by every caller.
 * <p>
 * Owns the connection pool, cache, rate limiter, circuit breakers, metrics and
 * diagnostics, and exposes the {@code api} upstream as an {@link ApiClient}. Other
 * upstreams are reached through {@link #upstream(String, String)}.
 * <p>
 * {@link #start()} launches the background loops (metrics compaction, diagnostics
 * self-check, resource monitoring with health probes); {@link #close()} stops them and
 * releases the pool, transport and shared cache.
 * <p>
 * Usage:
 * <pre>{@code
 * try (ClientRuntime runtime = new ClientRuntime(ClientConfig.fromEnvironment())) {
 *     runtime.start();
 *     ApiResponse<JsonNode> plans = runtime.cachedGet("plans", Map.of(), Duration.ofMinutes(5));
 *     runtime.post("orders", Map.of("plan", "monthly"));
 * }
 * }</pre>
 */
public class ClientRuntime implements ApiClient, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientRuntime.class);

    public static final String CACHE_HITS = "cache_hits";
    public static final String CACHE_MISSES = "cache_misses";
    public static final String SYSTEM_PREFIX = "system_";
    public static final String HEALTH_BACKEND = "backend";

    static final String CACHE_NAMESPACE = "bastion:";
    static final Duration STATUS_WINDOW = Duration.ofMinutes(5);
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);
    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");
    private static final List<String> REPORTED_METRICS = List.of(
            RequestOrchestrator.API_LATENCY,
            RequestOrchestrator.API_ERRORS,
            RequestOrchestrator.RATE_LIMITS,
            CACHE_HITS,
            CACHE_MISSES);

    private enum State { CREATED, RUNNING, STOPPED, CLOSED }

    private final ClientConfig config;
    private final ObjectMapper mapper;
    private final Transport transport;
    private final SharedCacheBackend sharedCache;
    private final BreakerRegistry breakers;
    private final WindowedMetricsManager metrics;
    private final SystemMonitor systemMonitor;
    private final Diagnostics diagnostics;
    private final HealthCheck healthCheck;
    private final CacheManager cache;
    private final SlidingWindowRateLimiter limiter;
    private final DefaultConnectionPool pool;
    private final RetryExecutor retry;
    private final RequestOrchestrator api;
    private final Map<String, RequestOrchestrator> upstreams = new ConcurrentHashMap<>();

    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
    private ScheduledExecutorService scheduler;

    public ClientRuntime(ClientConfig config) {
        this(config, new JdkHttpTransport(config.timeout()), sharedCacheFor(config), new SimpleMeterRegistry());
    }

    public ClientRuntime(ClientConfig config, Transport transport, SharedCacheBackend sharedCache,
                         MeterRegistry registry) {
        this(config, transport, sharedCache, registry, new SystemMonitor(),
                new RetryExecutor(config.maxRetries(), config.retryBaseDelay()));
    }

    public ClientRuntime(ClientConfig config, Transport transport, SharedCacheBackend sharedCache,
                         MeterRegistry registry, SystemMonitor systemMonitor, RetryExecutor retry) {
        this.config = config;
        this.transport = transport;
        this.sharedCache = sharedCache;
        this.systemMonitor = systemMonitor;
        this.retry = retry;

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.breakers = new BreakerRegistry(config);
        this.metrics = new WindowedMetricsManager(registry, config.clock(), config.metricsRetention());
        this.diagnostics = new Diagnostics(config.clock(), systemMonitor);
        this.cache = new CacheManager(sharedCache, breakers.breaker(BreakerRegistry.CACHE_BACKEND),
                config.localCacheTtlCap(), config.clock());
        this.limiter = new SlidingWindowRateLimiter(config.rateLimitMaxRequests(), config.rateLimitWindow(),
                config.clock());
        this.pool = new DefaultConnectionPool(BreakerRegistry.API, transport, config.poolMaxSize(),
                config.userAgent());
        this.api = newOrchestrator(BreakerRegistry.API, config.baseUrl());

        this.healthCheck = new HealthCheck(config.healthCacheTtl(), config.clock())
                .register(HEALTH_BACKEND, HealthProbe.tcp(config.baseUrl(), PROBE_TIMEOUT))
                .register(BreakerRegistry.CACHE_BACKEND, sharedCache::ping);

        log.info("Client runtime created for {}", config.baseUrl());
    }

    @Override
    public ApiResponse<JsonNode> request(String method, String path, Object body,
                                         Map<String, String> params, Map<String, String> headers,
                                         Duration timeout) {
        ApiResponse<JsonNode> response = api.request(method, path, body, params, headers, timeout);
        if (MUTATING_METHODS.contains(method.toUpperCase(Locale.ROOT))) {
            cache.invalidatePattern(CACHE_NAMESPACE + resourcePrefix(path));
        }
        return response;
    }

    /**
     * GET through the response cache. A hit is returned with {@code cached=true}; on a
     * miss the request is issued and non-empty data is stored for {@code ttl}.
     *
     * @param ttl time to keep the response, or null for the configured default
     */
    public ApiResponse<JsonNode> cachedGet(String path, Map<String, String> params, Duration ttl) {
        String key = cacheKey(path, params);

        Optional<String> hit = cache.get(key);
        if (hit.isPresent()) {
            try {
                JsonNode data = mapper.readTree(hit.get());
                metrics.record(CACHE_HITS, 1, Map.of("endpoint", stripSlash(path)));
                return ApiResponse.fromCache(data, config.clock().instant());
            } catch (JsonProcessingException e) {
                log.warn("Dropping unreadable cache entry '{}': {}", key, e.getOriginalMessage());
                cache.delete(key);
            }
        }
        metrics.record(CACHE_MISSES, 1, Map.of("endpoint", stripSlash(path)));

        ApiResponse<JsonNode> response = get(path, params);
        if (response.data() != null) {
            try {
                cache.set(key, mapper.writeValueAsString(response.data()), ttl != null ? ttl : config.defaultCacheTtl());
            } catch (JsonProcessingException e) {
                log.warn("Response for '{}' could not be cached: {}", key, e.getOriginalMessage());
            }
        }
        return response;
    }

    /**
     * Client for another upstream, sharing this runtime's pool, limiter, metrics and
     * diagnostics but guarded by the breaker registered under {@code name}.
     * The upstream's base URL is also probed by the health check. The {@code api} name
     * returns this runtime, whatever the base URL.
     *
     * @throws IllegalArgumentException if no breaker is registered under {@code name}
     */
    public ApiClient upstream(String name, String baseUrl) {
        if (BreakerRegistry.API.equals(name)) {
            return this;
        }
        if (BreakerRegistry.CACHE_BACKEND.equals(name)) {
            throw new IllegalArgumentException("Not an HTTP upstream: " + name);
        }
        return upstreams.computeIfAbsent(name, n -> {
            RequestOrchestrator orchestrator = newOrchestrator(n, baseUrl);
            healthCheck.register(n, HealthProbe.tcp(baseUrl, PROBE_TIMEOUT));
            log.info("Registered upstream '{}' at {}", n, baseUrl);
            return orchestrator;
        });
    }

    public RuntimeStatus getStatus() {
        Map<String, MetricStats> stats = new TreeMap<>();
        Set<String> names = new TreeSet<>(REPORTED_METRICS);
        metrics.names().stream().filter(n -> n.startsWith(SYSTEM_PREFIX)).forEach(names::add);
        for (String name : names) {
            stats.put(name, metrics.getStats(name, STATUS_WINDOW));
        }

        return new RuntimeStatus(
                healthCheck.checkAll(),
                stats,
                diagnostics.getDiagnostics(),
                breakers.metrics(),
                new ConnectionStats(pool.activeCount(), pool.availableCount(), pool.maxSize()),
                config.clock().instant());
    }

    /**
     * Start the background loops. Calling it again while running has no effect.
     */
    public void start() {
        if (!state.compareAndSet(State.CREATED, State.RUNNING)
                && !state.compareAndSet(State.STOPPED, State.RUNNING)) {
            if (state.get() == State.CLOSED) {
                throw new IllegalStateException("Client runtime is closed");
            }
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bastion-runtime");
            t.setDaemon(true);
            return t;
        });

        schedule("metrics compaction", config.metricsCompactionInterval(), () -> {
            metrics.compact();
            cache.purgeExpired();
        });
        schedule("diagnostics self-check", config.diagnosticsInterval(), diagnostics::runSelfCheck);
        schedule("monitoring", config.monitoringInterval(), this::monitor);

        log.info("Client runtime started");
    }

    /**
     * Stop the background loops. Safe to call when not started.
     */
    public void stop() {
        if (state.compareAndSet(State.RUNNING, State.STOPPED)) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("Client runtime stopped");
        }
    }

    @Override
    public void close() {
        stop();
        if (state.getAndSet(State.CLOSED) == State.CLOSED) {
            return;
        }
        pool.close();
        transport.close();
        sharedCache.close();
        log.info("Client runtime closed");
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    void monitor() {
        systemMonitor.sample().forEach((name, value) -> {
            if (value >= 0) {
                metrics.record(SYSTEM_PREFIX + name, value);
            }
        });
        healthCheck.checkAll();
    }

    private void schedule(String task, Duration interval, Runnable body) {
        scheduler.scheduleAtFixedRate(() -> {
            try {
                body.run();
            } catch (Exception e) {
                log.error("Error in {} loop", task, e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private RequestOrchestrator newOrchestrator(String name, String baseUrl) {
        return new RequestOrchestrator(name, baseUrl, config, pool, limiter, breakers.breaker(name),
                metrics, diagnostics, mapper, retry);
    }

    static String cacheKey(String path, Map<String, String> params) {
        StringBuilder key = new StringBuilder(CACHE_NAMESPACE).append(stripSlash(path));
        if (params != null && !params.isEmpty()) {
            StringJoiner query = new StringJoiner("&", "?", "");
            new TreeMap<>(params).forEach((k, v) -> query.add(k + "=" + v));
            key.append(query);
        }
        return key.toString();
    }

    static String resourcePrefix(String path) {
        String stripped = stripSlash(path);
        int slash = stripped.indexOf('/');
        return slash < 0 ? stripped : stripped.substring(0, slash);
    }

    private static String stripSlash(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }

    private static SharedCacheBackend sharedCacheFor(ClientConfig config) {
        if (config.redisUri() != null) {
            return new LettuceSharedCache(config.redisUri(), PROBE_TIMEOUT);
        }
        return new InMemorySharedCache(config.clock());
    }

    public ClientConfig config() { return config; }
    public WindowedMetricsManager metrics() { return metrics; }
    public Diagnostics diagnostics() { return diagnostics; }
    public CacheManager cache() { return cache; }
    public BreakerRegistry breakers() { return breakers; }
    public DefaultConnectionPool pool() { return pool; }
    public HealthCheck healthCheck() { return healthCheck; }
    public SlidingWindowRateLimiter rateLimiter() { return limiter; }
}
