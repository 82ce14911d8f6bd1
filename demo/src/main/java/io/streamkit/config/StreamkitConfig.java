package io.streamkit.config;

import io.streamkit.ratelimit.RateLimiterConfig;
import io.streamkit.workers.WorkerOptions;
import io.streamkit.workers.WorkerPoolConfig;

public record StreamkitConfig(
        int minWorkers,
        int maxWorkers,
        int maxQueueSize,
        long idleTimeoutMs,
        double rateCapacity,
        double ratePerSecond,
        int batchSize,
        long batchTimeoutMs
) {
    public static StreamkitConfig fromEnv() {
        int min = Integer.parseInt(System.getProperty("streamkit.workers.min", System.getenv().getOrDefault("STREAMKIT_WORKERS_MIN", "1")));
        int max = Integer.parseInt(System.getProperty("streamkit.workers.max", System.getenv().getOrDefault("STREAMKIT_WORKERS_MAX", "4")));
        int queue = Integer.parseInt(System.getProperty("streamkit.queue", System.getenv().getOrDefault("STREAMKIT_QUEUE", "1000")));
        long idle = Long.parseLong(System.getProperty("streamkit.idle.ms", System.getenv().getOrDefault("STREAMKIT_IDLE_MS", "30000")));
        double capacity = Double.parseDouble(System.getProperty("streamkit.rate.capacity", System.getenv().getOrDefault("STREAMKIT_RATE_CAPACITY", "50")));
        double rate = Double.parseDouble(System.getProperty("streamkit.rate.per.sec", System.getenv().getOrDefault("STREAMKIT_RATE_PER_SEC", "50")));
        int batch = Integer.parseInt(System.getProperty("streamkit.batch.size", System.getenv().getOrDefault("STREAMKIT_BATCH_SIZE", "10")));
        long batchTimeout = Long.parseLong(System.getProperty("streamkit.batch.timeout.ms", System.getenv().getOrDefault("STREAMKIT_BATCH_TIMEOUT_MS", "250")));
        return new StreamkitConfig(min, max, queue, idle, capacity, rate, batch, batchTimeout);
    }

    public WorkerPoolConfig workerPoolConfig() {
        return new WorkerPoolConfig(minWorkers, maxWorkers, idleTimeoutMs, maxQueueSize,
                WorkerPoolConfig.DEFAULT_REAP_INTERVAL_MS, WorkerOptions.DEFAULT);
    }

    public RateLimiterConfig rateLimiterConfig() {
        return RateLimiterConfig.of(rateCapacity, ratePerSecond);
    }
}
