package io.streamkit.workers;

import com.codahale.metrics.MetricRegistry;
import io.streamkit.metrics.Metrics;

import java.time.Clock;
import java.util.Objects;

public class WorkerPoolBuilder<P, R> {
    private final WorkerHandler<P, R> handler;
    private WorkerPoolConfig config = WorkerPoolConfig.defaults();
    private MetricRegistry metricRegistry = new MetricRegistry();
    private String metricsPrefix = "workers";
    private WorkerPoolListener listener = WorkerPoolListener.NOOP;
    private Clock clock = Clock.systemUTC();

    WorkerPoolBuilder(WorkerHandler<P, R> handler) { this.handler = Objects.requireNonNull(handler, "handler"); }

    public WorkerPoolBuilder<P, R> config(WorkerPoolConfig c) { this.config = c; return this; }
    public WorkerPoolBuilder<P, R> workers(int min, int max) { this.config = config.withWorkers(min, max); return this; }
    public WorkerPoolBuilder<P, R> idleTimeoutMs(long ms) { this.config = config.withIdleTimeoutMs(ms); return this; }
    public WorkerPoolBuilder<P, R> maxQueueSize(int n) { this.config = config.withMaxQueueSize(n); return this; }
    public WorkerPoolBuilder<P, R> reapIntervalMs(long ms) { this.config = config.withReapIntervalMs(ms); return this; }
    public WorkerPoolBuilder<P, R> workerOptions(WorkerOptions o) { this.config = config.withWorkerOptions(o); return this; }
    public WorkerPoolBuilder<P, R> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public WorkerPoolBuilder<P, R> metricsPrefix(String p) { this.metricsPrefix = p; return this; }
    public WorkerPoolBuilder<P, R> listener(WorkerPoolListener l) { this.listener = l; return this; }
    public WorkerPoolBuilder<P, R> clock(Clock c) { this.clock = c; return this; }

    public WorkerPool<P, R> build() {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metricRegistry, "metricRegistry");
        return new WorkerPool<>(handler, config, new Metrics(metricRegistry, metricsPrefix), listener, clock);
    }
}
