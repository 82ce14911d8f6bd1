package io.streamkit.metrics;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsTest {
    @Test
    void names_are_prefixed() {
        MetricRegistry registry = new MetricRegistry();
        Metrics metrics = new Metrics(registry, "pool");
        metrics.meter("submitted").mark();
        metrics.counter("failed").inc(2);
        assertEquals(1, registry.meter("pool.submitted").getCount());
        assertEquals(2, registry.counter("pool.failed").getCount());
    }

    @Test
    void gauge_registration_replaces_previous_one() {
        Metrics metrics = Metrics.detached("queue");
        metrics.gauge("depth", () -> 1);
        metrics.gauge("depth", () -> 2);
        Gauge<?> g = metrics.registry().getGauges().get("queue.depth");
        assertEquals(2, g.getValue());
        metrics.removeGauge("depth");
        assertFalse(metrics.registry().getGauges().containsKey("queue.depth"));
    }
}
