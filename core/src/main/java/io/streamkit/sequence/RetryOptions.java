package io.streamkit.sequence;

import io.streamkit.core.CancellationToken;
import io.streamkit.retry.ExponentialBackoffRetryPolicy;
import io.streamkit.retry.RetryPolicy;

import java.util.Objects;

/**
 * @param policy attempt budget, backoff and which errors are retried
 * @param token  optional; cancellation stops retrying, including during a backoff wait
 */
public record RetryOptions(RetryPolicy policy, CancellationToken token) {
    public RetryOptions {
        Objects.requireNonNull(policy, "policy");
    }

    /** Three attempts, {@code min(1000 * 2^(attempt-1), 30000)} ms apart, every error retried. */
    public static RetryOptions defaults() { return new RetryOptions(ExponentialBackoffRetryPolicy.DEFAULT, null); }

    public static RetryOptions of(RetryPolicy policy) { return new RetryOptions(policy, null); }

    public RetryOptions withToken(CancellationToken token) { return new RetryOptions(policy, token); }
}
