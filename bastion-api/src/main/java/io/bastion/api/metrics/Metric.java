package io.bastion.api.metrics;

import java.time.Instant;
import java.util.Map;

/**
 * A single recorded sample. Immutable once recorded.
 */
public record Metric(Instant timestamp, double value, Map<String, String> labels) {

    public Metric {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
