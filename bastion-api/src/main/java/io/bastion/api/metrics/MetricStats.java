package io.bastion.api.metrics;

/**
 * Aggregates of a metric over a trailing window.
 * {@code p95} is the value at sorted index {@code floor(0.95 * count)}, not an
 * interpolated percentile.
 */
public record MetricStats(long count, double min, double max, double mean, double median, double p95) {

    private static final MetricStats EMPTY = new MetricStats(0, 0, 0, 0, 0, 0);

    public static MetricStats empty() {
        return EMPTY;
    }
}
