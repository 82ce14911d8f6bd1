package io.streamkit.ratelimit;

import io.streamkit.core.Schedulers;
import io.streamkit.error.ValidationException;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket refilled lazily from elapsed wall time, with an optional sliding-window mode that counts
 * requests in a trailing window instead.
 * <p>
 * {@link #consume(int)} never blocks and never throws for a denial; {@link #acquire(int)} turns denials into a
 * delayed completion on the scheduler.
 */
public class TokenBucketRateLimiter {
    private final RateLimiterConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Deque<Long> requests = new ArrayDeque<>();

    private double tokens;
    private long lastRefill;

    public TokenBucketRateLimiter(RateLimiterConfig config) {
        this(config, Clock.systemUTC(), Schedulers.timer());
    }

    public TokenBucketRateLimiter(RateLimiterConfig config, Clock clock) {
        this(config, clock, Schedulers.timer());
    }

    public TokenBucketRateLimiter(RateLimiterConfig config, Clock clock, ScheduledExecutorService scheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.tokens = config.initialTokens();
        this.lastRefill = this.clock.millis();
    }

    public RateLimitResult consume() {
        return consume(1);
    }

    public synchronized RateLimitResult consume(int n) {
        ValidationException.requirePositive(n, "tokens");
        long now = clock.millis();
        refill(now);
        return config.slidingWindow() ? consumeFromWindow(n, now) : consumeFromBucket(n, now);
    }

    public synchronized RateLimiterStatus status() {
        refill(clock.millis());
        return new RateLimiterStatus((long) Math.floor(tokens), config.capacity(), config.refillRate());
    }

    public synchronized void reset() {
        tokens = config.initialTokens();
        lastRefill = clock.millis();
        requests.clear();
    }

    public RateLimiterConfig config() { return config; }

    public CompletionStage<Void> acquire() {
        return acquire(1);
    }

    /**
     * Completes once {@code n} tokens were consumed, retrying after each denial's {@code retryAfter}.
     * Completes exceptionally with a {@link ValidationException} if {@code n} can never fit the bucket.
     */
    public CompletionStage<Void> acquire(int n) {
        ValidationException.requirePositive(n, "tokens");
        if (n > config.capacity()) {
            return CompletableFuture.failedFuture(new ValidationException("cannot acquire " + n + " tokens from capacity " + config.capacity()));
        }
        CompletableFuture<Void> fut = new CompletableFuture<>();
        tryAcquire(n, fut);
        return fut;
    }

    private void tryAcquire(int n, CompletableFuture<Void> fut) {
        if (fut.isDone()) return;
        RateLimitResult result;
        try {
            result = consume(n);
        } catch (RuntimeException e) {
            fut.completeExceptionally(e);
            return;
        }
        if (result.allowed()) {
            fut.complete(null);
            return;
        }
        long delay = Math.max(1, result.retryAfter());
        scheduler.schedule(() -> tryAcquire(n, fut), delay, TimeUnit.MILLISECONDS);
    }

    private void refill(long now) {
        long elapsed = now - lastRefill;
        if (elapsed <= 0) return;
        tokens = Math.min(config.capacity(), tokens + (elapsed / 1000.0) * config.refillRate());
        lastRefill = now;
    }

    private RateLimitResult consumeFromBucket(int n, long now) {
        if (tokens >= n) {
            tokens -= n;
            long resetTime = now + (long) Math.ceil((config.capacity() - tokens) / config.refillRate() * 1000);
            return new RateLimitResult(true, (long) Math.floor(tokens), resetTime, 0);
        }
        long retryAfter = (long) Math.ceil((n - tokens) / config.refillRate() * 1000);
        return new RateLimitResult(false, (long) Math.floor(tokens), now + retryAfter, retryAfter);
    }

    private RateLimitResult consumeFromWindow(int n, long now) {
        long windowStart = now - config.windowSizeMs();
        while (!requests.isEmpty() && requests.peekFirst() < windowStart) {
            requests.pollFirst();
        }
        long capacity = (long) Math.floor(config.capacity());
        if (requests.size() + n <= capacity) {
            for (int i = 0; i < n; i++) requests.addLast(now);
            return new RateLimitResult(true, capacity - requests.size(), requests.peekFirst() + config.windowSizeMs(), 0);
        }
        long oldest = requests.isEmpty() ? now : requests.peekFirst();
        long resetTime = oldest + config.windowSizeMs();
        return new RateLimitResult(false, capacity - requests.size(), resetTime, Math.max(1, resetTime - now));
    }
}
