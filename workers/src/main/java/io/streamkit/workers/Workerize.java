package io.streamkit.workers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns a plain function into an asynchronous one that runs on its own {@link WorkerPool}.
 * <p>
 * Every workerized function stays registered until it is closed, so {@link #terminateAll()} can shut down
 * whatever is still running, for example from a shutdown hook.
 */
public final class Workerize {
    private static final Logger log = LoggerFactory.getLogger(Workerize.class);
    private static final AtomicLong ids = new AtomicLong();
    private static final Set<Workerized<?, ?>> live = ConcurrentHashMap.newKeySet();

    public static final long DEFAULT_IDLE_TIMEOUT_MS = 30_000;

    private Workerize() {
    }

    /** One worker up front, at most two, reaped after 30s idle. */
    public static WorkerPoolConfig defaultConfig() {
        return WorkerPoolConfig.defaults().withWorkers(1, 2).withIdleTimeoutMs(DEFAULT_IDLE_TIMEOUT_MS);
    }

    public static <P, R> Workerized<P, R> workerize(WorkerHandler<P, R> fn) {
        return workerize(fn, defaultConfig());
    }

    /**
     * Worker threads are named after the function's id ({@code workerized-N}); the daemon flag comes from
     * {@code config}.
     */
    public static <P, R> Workerized<P, R> workerize(WorkerHandler<P, R> fn, WorkerPoolConfig config) {
        Objects.requireNonNull(fn, "fn");
        Objects.requireNonNull(config, "config");
        String id = "workerized-" + ids.incrementAndGet();
        WorkerPool<P, R> pool = WorkerPool.builder(fn)
                .config(config)
                .workerOptions(new WorkerOptions(id, config.workerOptions().daemon()))
                .metricsPrefix(id)
                .build();
        Workerized<P, R> workerized = new Workerized<>(id, pool, live::remove);
        live.add(workerized);
        log.debug("Workerized {} with {}..{} workers", id, config.minWorkers(), config.maxWorkers());
        return workerized;
    }

    /** Gracefully terminates every workerized function not yet closed. */
    public static CompletableFuture<Void> terminateAll() {
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (Workerized<?, ?> w : List.copyOf(live)) {
            pending.add(w.terminate());
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]));
    }

    static int liveCount() {
        return live.size();
    }
}
