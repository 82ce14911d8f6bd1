package io.streamkit.workers;

import io.streamkit.ratelimit.RateLimitResult;
import io.streamkit.ratelimit.TokenBucketRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** Puts a token bucket in front of {@link WorkerPool#execute}. */
public class ThrottledSubmitter<P, R> {
    private static final Logger log = LoggerFactory.getLogger(ThrottledSubmitter.class);

    private final WorkerPool<P, R> pool;
    private final TokenBucketRateLimiter limiter;

    public ThrottledSubmitter(WorkerPool<P, R> pool, TokenBucketRateLimiter limiter) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
    }

    /** Submits only if a token is available right now; a denial never reaches the pool. */
    public Submission<R> trySubmit(P payload) {
        RateLimitResult decision = limiter.consume();
        if (!decision.allowed()) {
            log.debug("Submission denied, retry after {}ms", decision.retryAfter());
            return Submission.denied(decision);
        }
        return Submission.admitted(decision, pool.execute(payload));
    }

    /** Waits (without blocking the caller) for a token, then submits. */
    public CompletableFuture<R> submit(P payload) {
        return limiter.acquire().toCompletableFuture().thenCompose(v -> pool.execute(payload));
    }
}
