package io.streamkit.workers;

import io.streamkit.error.PoolTerminatingException;
import io.streamkit.error.WorkerFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerizeTest {
    private Workerized<?, ?> fn;

    @AfterEach
    void tearDown() {
        if (fn != null) fn.terminate();
    }

    @Test
    void calls_run_on_the_functions_own_worker_threads() throws Exception {
        Workerized<String, String> threadName = Workerize.workerize(p -> p + "@" + Thread.currentThread().getName());
        fn = threadName;
        String result = threadName.apply("hello").get(1, TimeUnit.SECONDS);
        assertTrue(result.startsWith("hello@" + threadName.id() + "-"), result);
        assertNotEquals(Thread.currentThread().getName(), result.substring("hello@".length()));
        assertEquals(2, threadName.pool().config().maxWorkers());
    }

    @Test
    void each_function_gets_its_own_pool() {
        Workerized<Integer, Integer> a = Workerize.workerize(x -> x + 1);
        Workerized<Integer, Integer> b = Workerize.workerize(x -> x * 2);
        try {
            assertNotEquals(a.id(), b.id());
            assertNotSame(a.pool(), b.pool());
        } finally {
            a.terminate();
            b.terminate();
        }
    }

    @Test
    void handler_failure_fails_the_call_with_the_original_cause() {
        Workerized<String, Integer> parse = Workerize.workerize(Integer::parseInt);
        fn = parse;
        ExecutionException e = assertThrows(ExecutionException.class, () -> parse.apply("x1").get(1, TimeUnit.SECONDS));
        WorkerFailureException failure = assertInstanceOf(WorkerFailureException.class, e.getCause());
        assertInstanceOf(NumberFormatException.class, failure.getCause());
    }

    @Test
    void byte_arrays_are_handed_over_as_transferables() throws Exception {
        Workerized<byte[], Integer> count = Workerize.workerize(new WorkerHandler<byte[], Integer>() {
            @Override
            public Integer handle(byte[] payload) {
                return -1;
            }

            @Override
            public Integer handle(byte[] payload, List<?> transferables) {
                return transferables.size() == 1 && transferables.get(0) == payload ? payload.length : -1;
            }
        });
        fn = count;
        assertEquals(16, count.apply(new byte[16]).get(1, TimeUnit.SECONDS));
    }

    @Test
    void terminate_all_shuts_down_open_functions() throws Exception {
        Workerized<String, String> upper = Workerize.workerize(String::toUpperCase);
        Workerized<String, String> lower = Workerize.workerize(String::toLowerCase);
        assertEquals("A", upper.apply("a").get(1, TimeUnit.SECONDS));

        Workerize.terminateAll().get(2, TimeUnit.SECONDS);

        assertTrue(upper.pool().isTerminating());
        assertTrue(lower.pool().isTerminating());
        ExecutionException e = assertThrows(ExecutionException.class, () -> lower.apply("B").get(1, TimeUnit.SECONDS));
        assertInstanceOf(PoolTerminatingException.class, e.getCause());
    }
}
