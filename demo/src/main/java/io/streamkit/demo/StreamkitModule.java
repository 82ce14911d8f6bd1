package io.streamkit.demo;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.streamkit.config.StreamkitConfig;
import io.streamkit.ratelimit.RateLimiterRegistry;
import io.streamkit.ratelimit.TokenBucketRateLimiter;
import io.streamkit.workers.WorkerPool;

public class StreamkitModule extends AbstractModule {
    private final StreamkitConfig config;

    public StreamkitModule(StreamkitConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(StreamkitConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton RateLimiterRegistry rateLimiterRegistry() { return new RateLimiterRegistry(); }

    @Provides @Singleton TokenBucketRateLimiter rateLimiter(RateLimiterRegistry registry) {
        return registry.get("demo", config.rateLimiterConfig());
    }

    @Provides @Singleton WorkerPool<Long, Long> workerPool(MetricRegistry registry) {
        return WorkerPool.builder(new CollatzHandler())
                .config(config.workerPoolConfig())
                .metrics(registry)
                .metricsPrefix("demo.workers")
                .build();
    }

    @Provides DemoPipeline pipeline(TokenBucketRateLimiter limiter, WorkerPool<Long, Long> pool) {
        return new DemoPipeline(limiter, pool, config.batchSize(), config.batchTimeoutMs());
    }
}
