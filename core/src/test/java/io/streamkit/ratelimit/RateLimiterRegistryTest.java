package io.streamkit.ratelimit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RateLimiterRegistryTest {
    @Test
    void returns_same_limiter_per_key() {
        RateLimiterRegistry registry = new RateLimiterRegistry(new MutableClock(0));
        TokenBucketRateLimiter a = registry.get("clients", RateLimiterConfig.of(2, 1));
        TokenBucketRateLimiter again = registry.get("clients", RateLimiterConfig.of(100, 100));
        assertSame(a, again);
        assertEquals(2, again.config().capacity());
    }

    @Test
    void remove_and_clear() {
        RateLimiterRegistry registry = new RateLimiterRegistry(new MutableClock(0));
        registry.get("a", RateLimiterConfig.of(1, 1));
        registry.get("b", RateLimiterConfig.of(1, 1));
        assertEquals(List.of("a", "b"), registry.keys().stream().sorted().toList());
        assertTrue(registry.remove("a"));
        assertFalse(registry.remove("a"));
        registry.clear();
        assertTrue(registry.keys().isEmpty());
    }
}
