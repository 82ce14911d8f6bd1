package io.streamkit.workers;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.streamkit.error.PoolTerminatingException;
import io.streamkit.error.QueueFullException;
import io.streamkit.error.WorkerFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerPoolTest {
    private final CountDownLatch release = new CountDownLatch(1);
    private WorkerPool<String, String> pool;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (pool != null) pool.terminate(true);
    }

    private String blockUntilReleased(String payload) throws InterruptedException {
        release.await();
        return payload.toUpperCase();
    }

    @Test
    void runs_tasks_on_workers() throws Exception {
        pool = WorkerPool.<String, String>builder(String::toUpperCase).workers(1, 2).build();
        assertEquals("A", pool.execute("a").get(1, TimeUnit.SECONDS));
        assertEquals("B", pool.execute("b", List.of(new byte[4])).get(1, TimeUnit.SECONDS));
        assertEquals(1, pool.stats().total());
    }

    @Test
    void fourth_task_is_rejected_when_workers_busy_and_queue_full() {
        pool = WorkerPool.<String, String>builder(this::blockUntilReleased)
                .workers(1, 2).maxQueueSize(1).build();
        CompletableFuture<String> first = pool.execute("a");
        CompletableFuture<String> second = pool.execute("b");
        CompletableFuture<String> queued = pool.execute("c");
        CompletableFuture<String> rejected = pool.execute("d");

        assertEquals(new PoolStats(2, 0, 2, 0, 1), pool.stats());
        ExecutionException e = assertThrows(ExecutionException.class, () -> rejected.get(1, TimeUnit.SECONDS));
        assertInstanceOf(QueueFullException.class, e.getCause());
        assertFalse(first.isDone() || second.isDone() || queued.isDone());
    }

    @Test
    void queued_tasks_are_assigned_in_submission_order() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();
        pool = WorkerPool.<String, String>builder(p -> {
            if (p.equals("gate")) release.await();
            order.add(p);
            return p;
        }).workers(1, 1).maxQueueSize(100).build();

        CompletableFuture<String> gate = pool.execute("gate");
        List<CompletableFuture<String>> rest = new ArrayList<>();
        for (int i = 0; i < 25; i++) rest.add(pool.execute("t" + i));
        assertEquals(25, pool.stats().queued());

        release.countDown();
        gate.get(1, TimeUnit.SECONDS);
        CompletableFuture.allOf(rest.toArray(new CompletableFuture[0])).get(2, TimeUnit.SECONDS);
        List<String> expected = new ArrayList<>();
        expected.add("gate");
        for (int i = 0; i < 25; i++) expected.add("t" + i);
        assertEquals(expected, order);
    }

    @Test
    void backlog_larger_than_one_drain_batch_is_drained_in_order() throws Exception {
        int workers = WorkerPool.DRAIN_BATCH + 5;
        int backlog = 45;
        CountDownLatch hold = new CountDownLatch(1);
        List<String> started = new CopyOnWriteArrayList<>();
        pool = WorkerPool.<String, String>builder(p -> {
            started.add(p);
            if (p.startsWith("gate")) release.await();
            else hold.await();
            return p;
        }).workers(workers, workers).maxQueueSize(backlog).build();

        List<CompletableFuture<String>> all = new ArrayList<>();
        for (int i = 0; i < workers; i++) all.add(pool.execute("gate" + i));
        for (int i = 0; i < backlog; i++) all.add(pool.execute("t" + i));
        assertEquals(new PoolStats(workers, 0, workers, 0, backlog), pool.stats());

        // every worker frees up at once; the first wave taken from the queue must be its head
        release.countDown();
        waitFor(() -> started.size() == 2 * workers);
        Set<String> firstWave = started.stream().filter(p -> p.startsWith("t")).collect(Collectors.toSet());
        Set<String> head = IntStream.range(0, workers).mapToObj(i -> "t" + i).collect(Collectors.toSet());
        assertEquals(head, firstWave);
        assertEquals(backlog - workers, pool.stats().queued());

        hold.countDown();
        CompletableFuture.allOf(all.toArray(new CompletableFuture[0])).get(2, TimeUnit.SECONDS);
        assertEquals(workers + backlog, started.size());
        waitFor(() -> pool.stats().idle() == workers);
        assertEquals(new PoolStats(workers, workers, 0, 0, 0), pool.stats());
    }

    @Test
    void handler_exception_fails_only_that_task() throws Exception {
        pool = WorkerPool.<String, String>builder(p -> {
            if (p.equals("bad")) throw new IllegalArgumentException("bad payload");
            return p;
        }).workers(1, 1).build();

        ExecutionException e = assertThrows(ExecutionException.class, () -> pool.execute("bad").get(1, TimeUnit.SECONDS));
        WorkerFailureException failure = assertInstanceOf(WorkerFailureException.class, e.getCause());
        assertEquals("worker-1", failure.workerId());
        assertInstanceOf(IllegalArgumentException.class, failure.getCause());

        assertEquals("ok", pool.execute("ok").get(1, TimeUnit.SECONDS));
        assertEquals(1, pool.stats().total());
    }

    @Test
    void worker_killed_by_error_is_replaced() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        WorkerPoolListener listener = new WorkerPoolListener() {
            @Override
            public void workerCreated(String workerId) { events.add("created " + workerId); }

            @Override
            public void workerTerminated(String workerId, int exitCode) { events.add("terminated " + workerId + " " + exitCode); }
        };
        pool = WorkerPool.<String, String>builder(p -> {
            if (p.equals("fatal")) throw new Error("worker crashed");
            return p;
        }).workers(1, 1).listener(listener).build();

        ExecutionException e = assertThrows(ExecutionException.class, () -> pool.execute("fatal").get(1, TimeUnit.SECONDS));
        assertInstanceOf(WorkerFailureException.class, e.getCause());
        assertInstanceOf(Error.class, e.getCause().getCause());

        assertEquals(List.of("created worker-1", "terminated worker-1 1", "created worker-2"), events);
        assertEquals("next", pool.execute("next").get(1, TimeUnit.SECONDS));
        assertEquals(1, pool.stats().total());
    }

    @Test
    void idle_workers_are_reaped_down_to_minimum() throws Exception {
        ManualClock clock = new ManualClock();
        pool = WorkerPool.<String, String>builder(this::blockUntilReleased)
                .workers(1, 3).idleTimeoutMs(1_000).reapIntervalMs(60_000).clock(clock).build();
        List<CompletableFuture<String>> running = List.of(pool.execute("a"), pool.execute("b"), pool.execute("c"));
        assertEquals(3, pool.stats().total());
        release.countDown();
        CompletableFuture.allOf(running.toArray(new CompletableFuture[0])).get(1, TimeUnit.SECONDS);
        waitFor(() -> pool.stats().idle() == 3);

        pool.reapIdleWorkers();
        assertEquals(3, pool.stats().total(), "nothing is idle long enough yet");

        clock.advance(1_001);
        pool.reapIdleWorkers();
        waitFor(() -> pool.stats().total() == 1);
        pool.reapIdleWorkers();
        assertEquals(1, pool.stats().total());
        assertEquals("X", pool.execute("x").get(1, TimeUnit.SECONDS));
    }

    @Test
    void graceful_terminate_rejects_queue_and_lets_running_tasks_finish() throws Exception {
        pool = WorkerPool.<String, String>builder(this::blockUntilReleased)
                .workers(1, 1).maxQueueSize(5).build();
        CompletableFuture<String> running = pool.execute("a");
        CompletableFuture<String> queued = pool.execute("b");

        CompletableFuture<Void> done = pool.terminate(false);
        assertSame(done, pool.terminate(false));
        assertTrue(pool.isTerminating());

        ExecutionException e = assertThrows(ExecutionException.class, () -> queued.get(1, TimeUnit.SECONDS));
        assertInstanceOf(PoolTerminatingException.class, e.getCause());
        CompletableFuture<String> late = pool.execute("c");
        e = assertThrows(ExecutionException.class, () -> late.get(1, TimeUnit.SECONDS));
        assertInstanceOf(PoolTerminatingException.class, e.getCause());
        assertFalse(done.isDone());

        release.countDown();
        assertEquals("A", running.get(1, TimeUnit.SECONDS));
        done.get(1, TimeUnit.SECONDS);
        waitFor(() -> pool.stats().total() == 0);
    }

    @Test
    void forced_terminate_fails_running_tasks() throws Exception {
        pool = WorkerPool.<String, String>builder(this::blockUntilReleased).workers(1, 2).build();
        CompletableFuture<String> running = pool.execute("a");

        CompletableFuture<Void> done = pool.terminate(true);
        assertTrue(done.isDone());
        ExecutionException e = assertThrows(ExecutionException.class, () -> running.get(1, TimeUnit.SECONDS));
        assertInstanceOf(PoolTerminatingException.class, e.getCause());
        waitFor(() -> pool.stats().total() == 0);
    }

    @Test
    void records_metrics_under_prefix() throws Exception {
        MetricRegistry registry = new MetricRegistry();
        pool = WorkerPool.<String, String>builder(String::trim)
                .workers(1, 1).metrics(registry).metricsPrefix("pool").build();
        pool.execute(" a ").get(1, TimeUnit.SECONDS);
        pool.execute(" b ").get(1, TimeUnit.SECONDS);

        assertEquals(2, registry.meter("pool.submitted").getCount());
        assertEquals(2, registry.meter("pool.completed").getCount());
        assertEquals(2, registry.timer("pool.task.time").getCount());
        assertEquals(1, registry.getGauges().get("pool.workers").getValue());
    }

    @Test
    void queue_wait_is_timed_from_submission_to_assignment() throws Exception {
        MetricRegistry registry = new MetricRegistry();
        ManualClock clock = new ManualClock();
        pool = WorkerPool.<String, String>builder(this::blockUntilReleased)
                .workers(1, 1).metrics(registry).metricsPrefix("pool").clock(clock).build();
        CompletableFuture<String> running = pool.execute("a");
        CompletableFuture<String> queued = pool.execute("b");
        assertEquals(1, registry.timer("pool.queue.wait").getCount());

        clock.advance(250);
        release.countDown();
        assertEquals("B", queued.get(1, TimeUnit.SECONDS));
        assertEquals("A", running.get());
        Timer wait = registry.timer("pool.queue.wait");
        assertEquals(2, wait.getCount());
        assertEquals(TimeUnit.MILLISECONDS.toNanos(250), wait.getSnapshot().getMax());
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("condition not met in time");
            Thread.sleep(5);
        }
    }
}
