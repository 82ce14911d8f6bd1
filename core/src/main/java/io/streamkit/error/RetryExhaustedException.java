package io.streamkit.error;

/**
 * Raised by the retry operator once it gives up. The last failure is the {@link #getCause() cause}.
 */
public class RetryExhaustedException extends StreamkitException {
    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("RETRY_EXHAUSTED", "Failed after " + attempts + " attempt" + (attempts == 1 ? "" : "s"), lastError);
        this.attempts = attempts;
    }

    public int attempts() { return attempts; }

    public Throwable lastError() { return getCause(); }
}
