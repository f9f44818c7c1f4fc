package io.histingest.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin wrapper over a {@link MetricRegistry} that namespaces every metric under a prefix
 * (e.g. {@code ingest.ohlcv-1d}).
 */
public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry) {
        this(registry, "ingest");
    }

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
    }

    public MetricRegistry registry() { return registry; }

    public String name(String metric) { return MetricRegistry.name(prefix, metric); }

    public Counter counter(String name) { return registry.counter(name(name)); }
    public Meter meter(String name) { return registry.meter(name(name)); }
    public Timer timer(String name) { return registry.timer(name(name)); }
    public Histogram histogram(String name) { return registry.histogram(name(name)); }
}
