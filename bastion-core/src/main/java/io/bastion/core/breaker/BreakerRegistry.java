package io.bastion.core.breaker;

import io.bastion.api.config.ClientConfig;
import io.bastion.api.status.BreakerMetrics;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Holds one circuit breaker per upstream name.
 * Breakers are created up front from the configuration, so lookups never race creation.
 */
public class BreakerRegistry {

    public static final String API = "api";
    public static final String CACHE_BACKEND = "cache-backend";
    public static final String PANEL = "panel";

    private final Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();

    public BreakerRegistry(ClientConfig config) {
        this(config, API, CACHE_BACKEND, PANEL);
    }

    public BreakerRegistry(ClientConfig config, String... upstreams) {
        for (String upstream : upstreams) {
            breakers.put(upstream, new CircuitBreaker(
                    upstream,
                    config.failureThreshold(),
                    config.recoveryTimeout(),
                    config.halfOpenLimit(),
                    config.clock()));
        }
    }

    /**
     * Get the breaker for a specific upstream.
     */
    public CircuitBreaker breaker(String upstream) {
        CircuitBreaker breaker = breakers.get(upstream);
        if (breaker == null) {
            throw new IllegalArgumentException("No circuit breaker for upstream: " + upstream);
        }
        return breaker;
    }

    /**
     * @return all breakers, in registration order
     */
    public Collection<CircuitBreaker> allBreakers() {
        return Collections.unmodifiableCollection(breakers.values());
    }

    public Map<String, BreakerMetrics> metrics() {
        Map<String, BreakerMetrics> metrics = new LinkedHashMap<>();
        breakers.forEach((name, breaker) -> metrics.put(name, breaker.metrics()));
        return metrics;
    }
}
