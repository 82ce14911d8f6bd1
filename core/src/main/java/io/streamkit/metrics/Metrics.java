package io.streamkit.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.Objects;

/**
 * Prefix-scoped view over a Dropwizard {@link MetricRegistry}. Components without a registry get a private
 * one from {@link #detached(String)} so instrumentation never needs null checks.
 */
public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public static Metrics detached(String prefix) { return new Metrics(new MetricRegistry(), prefix); }

    public MetricRegistry registry() { return registry; }
    public String prefix() { return prefix; }

    public String name(String metric) { return MetricRegistry.name(prefix, metric); }

    public Counter counter(String name) { return registry.counter(name(name)); }
    public Meter meter(String name) { return registry.meter(name(name)); }
    public Timer timer(String name) { return registry.timer(name(name)); }

    /** Registers a gauge, replacing one left behind by a previous component with the same prefix. */
    public <T> Gauge<T> gauge(String name, Gauge<T> gauge) {
        String full = name(name);
        registry.remove(full);
        return registry.register(full, gauge);
    }

    public void removeGauge(String name) { registry.remove(name(name)); }
}
