package io.streamkit.sequence;

import io.streamkit.core.CancellationToken;
import io.streamkit.error.ValidationException;

/**
 * @param timeoutMs flush a partial batch this long after its first item; {@code 0} waits for a full batch
 * @param token     optional; cancellation aborts the run
 */
public record BatchOptions(long timeoutMs, CancellationToken token) {
    public static final BatchOptions NONE = new BatchOptions(0, null);

    public BatchOptions {
        ValidationException.requireNonNegative(timeoutMs, "timeoutMs");
    }

    public static BatchOptions timeout(long timeoutMs) { return new BatchOptions(timeoutMs, null); }
}
