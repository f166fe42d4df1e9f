package io.bastion.core.breaker;

import io.bastion.api.status.BreakerMetrics;
import io.bastion.api.status.CircuitState;
import io.bastion.api.status.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Failure-isolation state machine for one upstream.
 * <p>
 * {@code CLOSED} counts failures since the circuit last changed state and opens once they
 * reach the threshold. Successes in {@code CLOSED} do not reset the count.
 * {@code OPEN} rejects calls until {@code recoveryTimeout} has passed since the last
 * failure, then moves to {@code HALF_OPEN} and lets the probe through. In
 * {@code HALF_OPEN} a single failure reopens the circuit, while {@code halfOpenLimit}
 * successes are needed to close it.
 * <p>
 * All reads and writes of the state and counters happen under the breaker's monitor,
 * so every transition is observed and recorded exactly once.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    static final int HISTORY_LIMIT = 100;
    private static final Duration HISTORY_REPORT_WINDOW = Duration.ofHours(24);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenLimit;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant lastFailureTime;
    private int halfOpenSuccesses;
    private long totalFailures;
    private long totalSuccesses;
    private final Deque<StateTransition> history = new ArrayDeque<>();

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, int halfOpenLimit, Clock clock) {
        if (failureThreshold <= 0 || halfOpenLimit <= 0) {
            throw new IllegalArgumentException("Failure threshold and half-open limit must be positive");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.halfOpenLimit = halfOpenLimit;
        this.clock = clock;
    }

    public synchronized boolean allowRequest() {
        switch (state) {
            case CLOSED:
            case HALF_OPEN:
                return true;
            case OPEN:
            default:
                Instant now = clock.instant();
                if (lastFailureTime == null || !now.isBefore(lastFailureTime.plus(recoveryTimeout))) {
                    transitionTo(CircuitState.HALF_OPEN, now);
                    return true;
                }
                return false;
        }
    }

    public synchronized void recordSuccess() {
        totalSuccesses++;
        if (state == CircuitState.HALF_OPEN) {
            halfOpenSuccesses++;
            if (halfOpenSuccesses >= halfOpenLimit) {
                transitionTo(CircuitState.CLOSED, clock.instant());
            }
        }
    }

    public synchronized void recordFailure() {
        Instant now = clock.instant();
        consecutiveFailures++;
        totalFailures++;
        lastFailureTime = now;

        if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            transitionTo(CircuitState.OPEN, now);
        } else if (state == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.OPEN, now);
        }
    }

    /**
     * Force the breaker back to {@code CLOSED}, e.g. after a manual fix upstream.
     */
    public synchronized void reset() {
        if (state != CircuitState.CLOSED) {
            transitionTo(CircuitState.CLOSED, clock.instant());
        }
        consecutiveFailures = 0;
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized List<StateTransition> history() {
        return List.copyOf(history);
    }

    public synchronized BreakerMetrics metrics() {
        long total = totalFailures + totalSuccesses;
        double failureRate = total > 0 ? (double) totalFailures / total : 0.0;
        Instant since = clock.instant().minus(HISTORY_REPORT_WINDOW);
        int recent = (int) history.stream().filter(t -> !t.timestamp().isBefore(since)).count();
        return new BreakerMetrics(
                name,
                state,
                consecutiveFailures,
                totalFailures,
                totalSuccesses,
                failureRate,
                history.peekLast(),
                recent
        );
    }

    public String name() {
        return name;
    }

    // caller holds the monitor
    private void transitionTo(CircuitState next, Instant now) {
        CircuitState previous = state;
        state = next;
        consecutiveFailures = 0;
        halfOpenSuccesses = 0;

        history.addLast(new StateTransition(now, previous, next));
        while (history.size() > HISTORY_LIMIT) {
            history.pollFirst();
        }
        log.warn("Circuit breaker '{}' state changed from {} to {}", name, previous.value(), next.value());
    }
}
