package io.streamkit.queue;

import io.streamkit.core.CancellationToken;
import io.streamkit.error.ValidationException;

import java.util.Objects;

/**
 * @param limit          maximum buffered items, {@code 0} for unbounded
 * @param overflowPolicy applied when {@code limit} is reached
 * @param token          optional; cancelling it aborts the queue
 */
public record QueueConfig(int limit, OverflowPolicy overflowPolicy, CancellationToken token) {
    public static final QueueConfig UNBOUNDED = new QueueConfig(0, OverflowPolicy.THROW, null);

    public QueueConfig {
        ValidationException.requireNonNegative(limit, "limit");
        Objects.requireNonNull(overflowPolicy, "overflowPolicy");
    }

    public static QueueConfig bounded(int limit, OverflowPolicy policy) { return new QueueConfig(limit, policy, null); }

    public QueueConfig withToken(CancellationToken token) { return new QueueConfig(limit, overflowPolicy, token); }
}
