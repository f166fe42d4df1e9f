package io.bastion.api.status;

/**
 * Point-in-time view of one circuit breaker.
 *
 * @param lastTransition     most recent state change, or null if it never changed
 * @param transitionsLast24h state changes in the trailing 24 hours
 */
public record BreakerMetrics(
        String name,
        CircuitState state,
        int consecutiveFailures,
        long totalFailures,
        long totalSuccesses,
        double failureRate,
        StateTransition lastTransition,
        int transitionsLast24h
) {}
