package io.bastion.api.status;

import io.bastion.api.metrics.MetricStats;

import java.time.Instant;
import java.util.Map;

/**
 * Comprehensive status of a client runtime, for external reporting.
 */
public record RuntimeStatus(
        Map<String, Boolean> health,
        Map<String, MetricStats> metrics,
        DiagnosticsSnapshot diagnostics,
        Map<String, BreakerMetrics> circuitBreakers,
        ConnectionStats connections,
        Instant timestamp
) {}
