package io.streamkit.ratelimit;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Keyed limiters, created on first use. The first config seen for a key wins. */
public class RateLimiterRegistry {
    private final Map<String, TokenBucketRateLimiter> limiters = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimiterRegistry() {
        this(Clock.systemUTC());
    }

    public RateLimiterRegistry(Clock clock) {
        this.clock = clock;
    }

    public TokenBucketRateLimiter get(String key, RateLimiterConfig config) {
        return limiters.computeIfAbsent(key, k -> new TokenBucketRateLimiter(config, clock));
    }

    public boolean remove(String key) {
        return limiters.remove(key) != null;
    }

    public void clear() {
        limiters.clear();
    }

    public List<String> keys() {
        return List.copyOf(limiters.keySet());
    }
}
