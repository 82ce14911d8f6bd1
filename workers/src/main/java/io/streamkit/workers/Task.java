package io.streamkit.workers;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** A submitted payload and the future its result goes to. Mutable fields are guarded by the pool lock. */
final class Task<P, R> {
    private static final Task<?, ?> STOP = new Task<>(null, List.of(), 0);

    final P payload;
    final List<?> transferables;
    final CompletableFuture<R> future = new CompletableFuture<>();
    final long enqueuedAt;
    long startedAt;

    Task(P payload, List<?> transferables, long enqueuedAt) {
        this.payload = payload;
        this.transferables = transferables;
        this.enqueuedAt = enqueuedAt;
    }

    /** Mailbox marker telling a worker to exit once it gets to it. */
    @SuppressWarnings("unchecked")
    static <P, R> Task<P, R> stop() {
        return (Task<P, R>) STOP;
    }

    boolean isStop() {
        return this == STOP;
    }
}
