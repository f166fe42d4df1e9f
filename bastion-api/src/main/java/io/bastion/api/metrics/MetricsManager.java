package io.bastion.api.metrics;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Windowed, in-memory numeric telemetry.
 */
public interface MetricsManager {

    /**
     * Append a sample to the named sequence.
     *
     * @param name   metric name, e.g. {@code api_latency}
     * @param value  sample value
     * @param labels dimensions of the sample, may be empty
     */
    void record(String name, double value, Map<String, String> labels);

    default void record(String name, double value) {
        record(name, value, Map.of());
    }

    /**
     * Aggregate the samples recorded within the trailing window.
     * Returns {@link MetricStats#empty()} when there are none.
     */
    MetricStats getStats(String name, Duration window);

    /**
     * Drop samples older than the retention bound.
     *
     * @return number of samples removed
     */
    int compact();

    /**
     * @return names that currently hold at least one sample
     */
    Set<String> names();
}
