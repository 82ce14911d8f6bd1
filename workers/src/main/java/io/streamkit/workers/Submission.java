package io.streamkit.workers;

import io.streamkit.ratelimit.RateLimitResult;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/** Admission decision for a rate-limited submission, plus the task's result when it was admitted. */
public final class Submission<R> {
    private final RateLimitResult decision;
    private final CompletableFuture<R> result;

    private Submission(RateLimitResult decision, CompletableFuture<R> result) {
        this.decision = Objects.requireNonNull(decision, "decision");
        this.result = result;
    }

    static <R> Submission<R> admitted(RateLimitResult decision, CompletableFuture<R> result) {
        return new Submission<>(decision, Objects.requireNonNull(result, "result"));
    }

    static <R> Submission<R> denied(RateLimitResult decision) {
        return new Submission<>(decision, null);
    }

    public boolean admitted() { return result != null; }

    public RateLimitResult decision() { return decision; }

    /** Millis until a retry can be admitted; 0 when admitted. */
    public long retryAfter() { return decision.retryAfter(); }

    public Optional<CompletableFuture<R>> result() { return Optional.ofNullable(result); }

    @Override
    public String toString() {
        return admitted() ? "Submission[admitted]" : "Submission[denied, retryAfter=" + retryAfter() + "]";
    }
}
