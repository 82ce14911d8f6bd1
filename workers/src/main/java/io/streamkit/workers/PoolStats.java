package io.streamkit.workers;

public record PoolStats(int total, int idle, int busy, int terminating, int queued) {
}
