package io.bastion.core.metrics;

import io.bastion.api.metrics.Metric;
import io.bastion.api.metrics.MetricStats;
import io.bastion.api.metrics.MetricsManager;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default metrics manager.
 * Keeps raw samples per metric name for windowed queries, and mirrors every sample into
 * a Micrometer registry so a host application can export them.
 * Samples older than the retention bound are dropped by {@link #compact()}, which the
 * runtime schedules periodically.
 */
public class WindowedMetricsManager implements MetricsManager {

    private static final Logger log = LoggerFactory.getLogger(WindowedMetricsManager.class);

    private final MeterRegistry registry;
    private final Clock clock;
    private final Duration retention;
    private final Map<String, List<Metric>> series = new HashMap<>();
    private final Map<String, DistributionSummary> summaries = new ConcurrentHashMap<>();

    public WindowedMetricsManager(Clock clock, Duration retention) {
        this(new SimpleMeterRegistry(), clock, retention);
    }

    public WindowedMetricsManager(MeterRegistry registry, Clock clock, Duration retention) {
        this.registry = registry;
        this.clock = clock;
        this.retention = retention;
    }

    @Override
    public void record(String name, double value, Map<String, String> labels) {
        Metric metric = new Metric(clock.instant(), value, labels);
        synchronized (series) {
            series.computeIfAbsent(name, k -> new ArrayList<>()).add(metric);
        }
        getSummary(name).record(value);
    }

    @Override
    public MetricStats getStats(String name, Duration window) {
        Instant cutoff = clock.instant().minus(window);
        double[] values;
        synchronized (series) {
            List<Metric> samples = series.getOrDefault(name, List.of());
            values = samples.stream()
                    .filter(m -> !m.timestamp().isBefore(cutoff))
                    .mapToDouble(Metric::value)
                    .toArray();
        }

        if (values.length == 0) {
            return MetricStats.empty();
        }

        Arrays.sort(values);
        int n = values.length;
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double median = n % 2 == 1
                ? values[n / 2]
                : (values[n / 2 - 1] + values[n / 2]) / 2.0;
        // sorted-index lookup, not interpolation
        double p95 = values[(n * 95) / 100];

        return new MetricStats(n, values[0], values[n - 1], sum / n, median, p95);
    }

    @Override
    public int compact() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        synchronized (series) {
            Iterator<Map.Entry<String, List<Metric>>> it = series.entrySet().iterator();
            while (it.hasNext()) {
                List<Metric> samples = it.next().getValue();
                int before = samples.size();
                samples.removeIf(m -> m.timestamp().isBefore(cutoff));
                removed += before - samples.size();
                if (samples.isEmpty()) {
                    it.remove();
                }
            }
        }
        if (removed > 0) {
            log.debug("Compacted {} metric samples older than {}s", removed, retention.toSeconds());
        }
        return removed;
    }

    @Override
    public Set<String> names() {
        synchronized (series) {
            return Set.copyOf(series.keySet());
        }
    }

    public MeterRegistry registry() {
        return registry;
    }

    private DistributionSummary getSummary(String name) {
        return summaries.computeIfAbsent(name, n ->
                DistributionSummary.builder("bastion." + n.replace('_', '.'))
                        .register(registry));
    }
}
