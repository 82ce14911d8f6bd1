package io.streamkit.ratelimit;

import io.streamkit.error.ValidationException;

/**
 * @param capacity      bucket size, and the request budget per window in sliding-window mode
 * @param refillRate    tokens added per second
 * @param initialTokens tokens available at start and after {@code reset()}
 * @param slidingWindow count requests in a trailing window instead of spending tokens
 * @param windowSizeMs  trailing window length
 */
public record RateLimiterConfig(double capacity, double refillRate, double initialTokens,
                                boolean slidingWindow, long windowSizeMs) {
    public static final long DEFAULT_WINDOW_MS = 60_000;

    public RateLimiterConfig {
        if (!(capacity > 0)) throw new ValidationException("capacity must be positive but was " + capacity);
        if (!(refillRate > 0)) throw new ValidationException("refillRate must be positive but was " + refillRate);
        if (initialTokens < 0 || initialTokens > capacity) {
            throw new ValidationException("initialTokens must be within [0, capacity] but was " + initialTokens);
        }
        ValidationException.requirePositive(windowSizeMs, "windowSizeMs");
    }

    public static RateLimiterConfig of(double capacity, double refillRate) {
        return new RateLimiterConfig(capacity, refillRate, capacity, false, DEFAULT_WINDOW_MS);
    }

    public static RateLimiterConfig slidingWindow(double capacity, double refillRate, long windowSizeMs) {
        return new RateLimiterConfig(capacity, refillRate, capacity, true, windowSizeMs);
    }

    public RateLimiterConfig withInitialTokens(double initialTokens) {
        return new RateLimiterConfig(capacity, refillRate, initialTokens, slidingWindow, windowSizeMs);
    }
}
