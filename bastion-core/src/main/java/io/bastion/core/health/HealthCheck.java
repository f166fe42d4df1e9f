package io.bastion.core.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-service health probes with cached results.
 * A probe runs at most once per {@code cacheTtl}; in between, the last result is returned.
 */
public class HealthCheck {

    private static final Logger log = LoggerFactory.getLogger(HealthCheck.class);

    private final Duration cacheTtl;
    private final Clock clock;
    private final Map<String, HealthProbe> probes = new LinkedHashMap<>();
    private final Map<String, Result> results = new LinkedHashMap<>();

    public HealthCheck(Duration cacheTtl, Clock clock) {
        this.cacheTtl = cacheTtl;
        this.clock = clock;
    }

    public synchronized HealthCheck register(String service, HealthProbe probe) {
        probes.put(service, probe);
        results.remove(service);
        return this;
    }

    public boolean check(String service) {
        HealthProbe probe;
        Instant now = clock.instant();
        synchronized (this) {
            probe = probes.get(service);
            if (probe == null) {
                throw new IllegalArgumentException("No health probe for service: " + service);
            }
            Result last = results.get(service);
            if (last != null && now.isBefore(last.checkedAt().plus(cacheTtl))) {
                return last.healthy();
            }
        }

        // probes may block on the network; run them without holding the monitor
        boolean healthy;
        try {
            healthy = probe.probe();
            if (!healthy) {
                log.error("Health check failed for {}", service);
            }
        } catch (Exception e) {
            log.error("Health check failed for {}: {}", service, e.getMessage());
            healthy = false;
        }

        synchronized (this) {
            if (probes.get(service) == probe) {
                results.put(service, new Result(healthy, now));
            }
        }
        return healthy;
    }

    /**
     * Check every registered service, in registration order.
     */
    public Map<String, Boolean> checkAll() {
        List<String> services;
        synchronized (this) {
            services = new ArrayList<>(probes.keySet());
        }
        Map<String, Boolean> status = new LinkedHashMap<>();
        for (String service : services) {
            status.put(service, check(service));
        }
        return status;
    }

    private record Result(boolean healthy, Instant checkedAt) {}
}
