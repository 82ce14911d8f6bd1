package io.streamkit.workers;

import io.streamkit.core.Schedulers;
import io.streamkit.error.OperatorTimeoutException;
import io.streamkit.error.PoolTerminatingException;
import io.streamkit.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Request/response client over a {@link WorkerPool} running an {@link RpcHandler}.
 * <p>
 * Each call gets an id and a deadline. A call that is still pending when the deadline passes fails with
 * {@link OperatorTimeoutException}; a late answer for it is dropped. Handler failures arrive as
 * {@link io.streamkit.error.WorkerFailureException} with the handler's exception as the cause.
 */
public final class WorkerRpc implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerRpc.class);

    public static final long DEFAULT_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_IDLE_TIMEOUT_MS = 60_000;

    private final WorkerPool<RpcRequest, Object> pool;
    private final long timeoutMs;
    private final Map<String, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();
    private final Map<String, Stub> stubs = new ConcurrentHashMap<>();
    private final AtomicLong requestIds = new AtomicLong();
    private final AtomicBoolean terminated = new AtomicBoolean();

    /** A method bound by name; see {@link #method(String)}. */
    @FunctionalInterface
    public interface Stub {
        CompletableFuture<Object> call(Object... params);
    }

    public WorkerRpc(WorkerPool<RpcRequest, Object> pool, long timeoutMs) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.timeoutMs = ValidationException.requirePositive(timeoutMs, "timeoutMs");
    }

    /** One to four workers, reaped after a minute idle. */
    public static WorkerPoolConfig defaultConfig() {
        return WorkerPoolConfig.defaults().withWorkers(1, 4).withIdleTimeoutMs(DEFAULT_IDLE_TIMEOUT_MS);
    }

    public static WorkerRpc create(RpcHandler handler) {
        return create(handler, defaultConfig(), DEFAULT_TIMEOUT_MS);
    }

    public static WorkerRpc create(RpcHandler handler, WorkerPoolConfig config, long timeoutMs) {
        WorkerPool<RpcRequest, Object> pool = WorkerPool.<RpcRequest, Object>builder(handler)
                .config(config)
                .metricsPrefix("rpc")
                .build();
        return new WorkerRpc(pool, timeoutMs);
    }

    /** Params may contain {@code null}. */
    public CompletableFuture<Object> call(String method, Object... params) {
        Objects.requireNonNull(method, "method");
        if (terminated.get()) {
            return CompletableFuture.failedFuture(new PoolTerminatingException("RPC interface has been terminated"));
        }
        String id = "rpc-" + requestIds.incrementAndGet();
        CompletableFuture<Object> result = new CompletableFuture<>();
        pending.put(id, result);
        ScheduledFuture<?> deadline = Schedulers.timer().schedule(() -> {
            if (pending.remove(id) != null) {
                log.debug("RPC {} to {} timed out", id, method);
                result.completeExceptionally(new OperatorTimeoutException(
                        "RPC call to " + method + " timed out after " + timeoutMs + "ms"));
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        RpcRequest request = new RpcRequest(id, method, Collections.unmodifiableList(Arrays.asList(params.clone())));
        pool.execute(request).whenComplete((value, error) -> {
            deadline.cancel(false);
            // gone when it timed out or the client terminated
            if (pending.remove(id) == null) return;
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(error);
            }
        });
        return result;
    }

    /** Same stub for the same name. */
    public Stub method(String name) {
        Objects.requireNonNull(name, "name");
        return stubs.computeIfAbsent(name, n -> params -> call(n, params));
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Fails every pending call with {@link PoolTerminatingException} and terminates the pool gracefully.
     * Idempotent.
     */
    public CompletableFuture<Void> terminate() {
        if (terminated.compareAndSet(false, true)) {
            for (String id : pending.keySet()) {
                CompletableFuture<Object> f = pending.remove(id);
                if (f != null) f.completeExceptionally(new PoolTerminatingException("RPC interface terminated"));
            }
        }
        return pool.terminate(false);
    }

    @Override
    public void close() {
        terminate();
    }
}
