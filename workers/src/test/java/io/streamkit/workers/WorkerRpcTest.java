package io.streamkit.workers;

import io.streamkit.error.OperatorTimeoutException;
import io.streamkit.error.PoolTerminatingException;
import io.streamkit.error.ValidationException;
import io.streamkit.error.WorkerFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerRpcTest {
    private final CountDownLatch release = new CountDownLatch(1);
    private WorkerRpc rpc;

    private final RpcHandler handler = RpcHandler.of(Map.of(
            "ping", (RpcMethod) params -> "pong",
            "noop", (RpcMethod) params -> null,
            "math", Map.of(
                    "add", (RpcMethod) params -> (Integer) params.get(0) + (Integer) params.get(1),
                    "div", (RpcMethod) params -> (Integer) params.get(0) / (Integer) params.get(1)),
            "await", (RpcMethod) params -> {
                release.await();
                return "released";
            }));

    @AfterEach
    void tearDown() {
        release.countDown();
        if (rpc != null) rpc.terminate();
    }

    @Test
    void nested_methods_are_registered_under_dotted_names() {
        assertEquals(Set.of("ping", "noop", "math.add", "math.div", "await"), handler.methodNames());
    }

    @Test
    void calls_are_dispatched_by_method_name() throws Exception {
        rpc = WorkerRpc.create(handler);
        assertEquals(5, rpc.call("math.add", 2, 3).get(1, TimeUnit.SECONDS));
        assertEquals("pong", rpc.method("ping").call().get(1, TimeUnit.SECONDS));
        assertNull(rpc.call("noop", (Object) null).get(1, TimeUnit.SECONDS));
        assertSame(rpc.method("math.add"), rpc.method("math.add"));
        assertEquals(0, rpc.pendingCount());
    }

    @Test
    void unknown_method_fails_only_that_call() throws Exception {
        rpc = WorkerRpc.create(handler);
        ExecutionException e = assertThrows(ExecutionException.class, () -> rpc.call("math.mul", 2, 3).get(1, TimeUnit.SECONDS));
        WorkerFailureException failure = assertInstanceOf(WorkerFailureException.class, e.getCause());
        ValidationException cause = assertInstanceOf(ValidationException.class, failure.getCause());
        assertEquals("Method math.mul not found", cause.getMessage());
        assertEquals(2, rpc.call("math.div", 4, 2).get(1, TimeUnit.SECONDS));
    }

    @Test
    void method_exception_travels_as_the_cause() {
        rpc = WorkerRpc.create(handler);
        ExecutionException e = assertThrows(ExecutionException.class, () -> rpc.call("math.div", 1, 0).get(1, TimeUnit.SECONDS));
        assertInstanceOf(ArithmeticException.class, e.getCause().getCause());
    }

    @Test
    void slow_call_times_out_and_late_answer_is_dropped() throws Exception {
        rpc = WorkerRpc.create(handler, WorkerRpc.defaultConfig(), 50);
        CompletableFuture<Object> slow = rpc.call("await");
        ExecutionException e = assertThrows(ExecutionException.class, () -> slow.get(1, TimeUnit.SECONDS));
        OperatorTimeoutException timeout = assertInstanceOf(OperatorTimeoutException.class, e.getCause());
        assertEquals("RPC call to await timed out after 50ms", timeout.getMessage());
        assertEquals(0, rpc.pendingCount());

        release.countDown();
        assertEquals("pong", rpc.call("ping").get(1, TimeUnit.SECONDS));
        assertTrue(slow.isCompletedExceptionally());
    }

    @Test
    void terminate_fails_pending_and_later_calls() {
        rpc = WorkerRpc.create(handler);
        CompletableFuture<Object> pending = rpc.call("await");
        rpc.terminate();

        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(1, TimeUnit.SECONDS));
        assertInstanceOf(PoolTerminatingException.class, e.getCause());
        ExecutionException later = assertThrows(ExecutionException.class, () -> rpc.call("ping").get(1, TimeUnit.SECONDS));
        assertEquals("RPC interface has been terminated", later.getCause().getMessage());
    }

    @Test
    void invalid_method_tables_are_rejected() {
        assertThrows(ValidationException.class, () -> RpcHandler.of(Map.of("bad", "not a method")));
        RpcHandler.Builder builder = RpcHandler.builder().method("a", params -> 1);
        assertThrows(ValidationException.class, () -> builder.method("a", params -> 2));
    }
}
