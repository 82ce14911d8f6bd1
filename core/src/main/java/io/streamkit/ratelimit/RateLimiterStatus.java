package io.streamkit.ratelimit;

public record RateLimiterStatus(long tokens, double capacity, double refillRate) {
}
