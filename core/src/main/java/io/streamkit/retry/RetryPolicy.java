package io.streamkit.retry;

/**
 * Decides whether a failed attempt is retried and how long to wait first. Attempts are 1-based.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);

    long backoffMillis(int attempt);

    int maxAttempts();
}
