package io.streamkit.workers;

import io.streamkit.error.ValidationException;

import java.util.Objects;

/**
 * @param minWorkers     workers started up front and kept through idle reaping
 * @param maxWorkers     hard cap on live workers
 * @param idleTimeoutMs  idle time after which a worker above {@code minWorkers} is reaped
 * @param maxQueueSize   tasks waiting for a worker; further submissions fail with {@code QueueFullException}
 * @param reapIntervalMs period of the idle sweep
 */
public record WorkerPoolConfig(int minWorkers, int maxWorkers, long idleTimeoutMs, int maxQueueSize,
                               long reapIntervalMs, WorkerOptions workerOptions) {
    public static final long DEFAULT_IDLE_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 1000;
    public static final long DEFAULT_REAP_INTERVAL_MS = 1000;

    public WorkerPoolConfig {
        ValidationException.requireNonNegative(minWorkers, "minWorkers");
        ValidationException.requirePositive(maxWorkers, "maxWorkers");
        if (minWorkers > maxWorkers) {
            throw new ValidationException("minWorkers (" + minWorkers + ") must not exceed maxWorkers (" + maxWorkers + ")");
        }
        ValidationException.requireNonNegative(idleTimeoutMs, "idleTimeoutMs");
        ValidationException.requireNonNegative(maxQueueSize, "maxQueueSize");
        ValidationException.requirePositive(reapIntervalMs, "reapIntervalMs");
        Objects.requireNonNull(workerOptions, "workerOptions");
    }

    /** One worker minimum, one per spare core maximum. */
    public static WorkerPoolConfig defaults() {
        int cores = Runtime.getRuntime().availableProcessors();
        return new WorkerPoolConfig(1, Math.max(1, cores - 1), DEFAULT_IDLE_TIMEOUT_MS, DEFAULT_MAX_QUEUE_SIZE,
                DEFAULT_REAP_INTERVAL_MS, WorkerOptions.DEFAULT);
    }

    public WorkerPoolConfig withWorkers(int minWorkers, int maxWorkers) {
        return new WorkerPoolConfig(minWorkers, maxWorkers, idleTimeoutMs, maxQueueSize, reapIntervalMs, workerOptions);
    }

    public WorkerPoolConfig withIdleTimeoutMs(long idleTimeoutMs) {
        return new WorkerPoolConfig(minWorkers, maxWorkers, idleTimeoutMs, maxQueueSize, reapIntervalMs, workerOptions);
    }

    public WorkerPoolConfig withMaxQueueSize(int maxQueueSize) {
        return new WorkerPoolConfig(minWorkers, maxWorkers, idleTimeoutMs, maxQueueSize, reapIntervalMs, workerOptions);
    }

    public WorkerPoolConfig withReapIntervalMs(long reapIntervalMs) {
        return new WorkerPoolConfig(minWorkers, maxWorkers, idleTimeoutMs, maxQueueSize, reapIntervalMs, workerOptions);
    }

    public WorkerPoolConfig withWorkerOptions(WorkerOptions workerOptions) {
        return new WorkerPoolConfig(minWorkers, maxWorkers, idleTimeoutMs, maxQueueSize, reapIntervalMs, workerOptions);
    }
}
