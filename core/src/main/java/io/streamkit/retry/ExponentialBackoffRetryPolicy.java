package io.streamkit.retry;

import io.streamkit.error.ValidationException;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * {@code min(base * 2^(attempt-1), max)} with optional symmetric jitter, retrying only errors accepted by
 * {@code retryIf}.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    public static final ExponentialBackoffRetryPolicy DEFAULT = new ExponentialBackoffRetryPolicy(3, 1000, 30_000);

    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final double jitter;
    private final Predicate<? super Exception> retryIf;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, 0.0, e -> true);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis, double jitter,
                                         Predicate<? super Exception> retryIf) {
        this.maxAttempts = ValidationException.requirePositive(maxAttempts, "maxAttempts");
        this.baseMillis = ValidationException.requireNonNegative(baseMillis, "baseMillis");
        this.maxMillis = Math.max(baseMillis, maxMillis);
        if (jitter < 0 || jitter > 1) throw new ValidationException("jitter must be within [0, 1] but was " + jitter);
        this.jitter = jitter;
        this.retryIf = Objects.requireNonNull(retryIf, "retryIf");
    }

    /** Same delay before every retry. */
    public static ExponentialBackoffRetryPolicy fixed(int maxAttempts, long delayMillis) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, delayMillis, delayMillis);
    }

    public ExponentialBackoffRetryPolicy withMaxAttempts(int maxAttempts) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseMillis, maxMillis, jitter, retryIf);
    }

    public ExponentialBackoffRetryPolicy withJitter(double jitter) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseMillis, maxMillis, jitter, retryIf);
    }

    public ExponentialBackoffRetryPolicy retryIf(Predicate<? super Exception> retryIf) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseMillis, maxMillis, jitter, retryIf);
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts && retryIf.test(e);
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = Math.min(baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1))), maxMillis);
        if (jitter > 0) {
            double factor = 1 + (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitter;
            delay = Math.round(delay * factor);
        }
        return delay;
    }

    @Override
    public int maxAttempts() { return maxAttempts; }
}
