package io.streamkit.workers;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A function whose calls run on a dedicated {@link WorkerPool}. Byte arrays and buffers passed as the argument
 * are handed to the worker as transferables. A handler exception fails the returned future with a
 * {@link io.streamkit.error.WorkerFailureException} carrying it as the cause.
 */
public final class Workerized<P, R> implements Function<P, CompletableFuture<R>>, AutoCloseable {
    private final String id;
    private final WorkerPool<P, R> pool;
    private final Consumer<Workerized<P, R>> onTerminate;

    Workerized(String id, WorkerPool<P, R> pool, Consumer<Workerized<P, R>> onTerminate) {
        this.id = id;
        this.pool = pool;
        this.onTerminate = onTerminate;
    }

    @Override
    public CompletableFuture<R> apply(P argument) {
        return pool.execute(argument, transferablesOf(argument));
    }

    public String id() { return id; }

    public WorkerPool<P, R> pool() { return pool; }

    /** Graceful; calls made afterwards fail with {@link io.streamkit.error.PoolTerminatingException}. */
    public CompletableFuture<Void> terminate() {
        onTerminate.accept(this);
        return pool.terminate(false);
    }

    @Override
    public void close() {
        terminate();
    }

    private static List<?> transferablesOf(Object argument) {
        if (argument instanceof byte[] || argument instanceof ByteBuffer) return List.of(argument);
        return List.of();
    }
}
