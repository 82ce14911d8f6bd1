package io.streamkit.ratelimit;

/**
 * Outcome of {@link TokenBucketRateLimiter#consume(int)}. Denials are values, never exceptions.
 *
 * @param remaining  whole tokens (or window slots) left after the call
 * @param resetTime  epoch millis at which the limiter is full again (bucket) or the oldest request leaves the window
 * @param retryAfter millis to wait before the same request can succeed; {@code 0} when allowed
 */
public record RateLimitResult(boolean allowed, long remaining, long resetTime, long retryAfter) {
}
