package io.streamkit.demo;

import io.streamkit.core.CancellationToken;
import io.streamkit.error.WorkerFailureException;
import io.streamkit.ratelimit.TokenBucketRateLimiter;
import io.streamkit.sequence.BatchOptions;
import io.streamkit.sequence.Operators;
import io.streamkit.sequence.Sequence;
import io.streamkit.sequence.Sequences;
import io.streamkit.sequence.TimedOperators;
import io.streamkit.workers.WorkerPool;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * interval -> rate limit -> worker pool -> batch. Each value {@code i} is sent to the pool as {@code i + 1}.
 */
public class DemoPipeline {
    private final TokenBucketRateLimiter limiter;
    private final WorkerPool<Long, Long> pool;
    private final int batchSize;
    private final long batchTimeoutMs;

    public DemoPipeline(TokenBucketRateLimiter limiter, WorkerPool<Long, Long> pool, int batchSize, long batchTimeoutMs) {
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.batchSize = batchSize;
        this.batchTimeoutMs = batchTimeoutMs;
    }

    public Sequence<List<Long>> build(long count, long intervalMs, CancellationToken token) {
        return Sequences.fromInterval(intervalMs, count, token)
                .pipe(TimedOperators.rateLimit(limiter))
                .pipe(Operators.map(i -> await(pool.execute(i + 1))))
                .pipe(TimedOperators.batch(batchSize, new BatchOptions(batchTimeoutMs, token)));
    }

    private static <R> R await(CompletableFuture<R> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new WorkerFailureException(null, String.valueOf(e.getCause()), e.getCause());
        }
    }
}
