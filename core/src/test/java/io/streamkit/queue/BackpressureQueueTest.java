package io.streamkit.queue;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import io.streamkit.core.CancellationToken;
import io.streamkit.error.OperationAbortedException;
import io.streamkit.error.QueueOverflowException;
import io.streamkit.error.UpstreamFailureException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class BackpressureQueueTest {
    @Test
    void drop_old_keeps_newest_items() {
        BackpressureQueue<Integer> q = new BackpressureQueue<>(QueueConfig.bounded(2, OverflowPolicy.DROP_OLD));
        q.enqueue(1);
        q.enqueue(2);
        q.enqueue(3);
        assertEquals(List.of(2, 3), q.snapshot());
        assertEquals(1, q.droppedCount());
    }

    @Test
    void drop_new_discards_incoming_item() {
        BackpressureQueue<Integer> q = new BackpressureQueue<>(QueueConfig.bounded(2, OverflowPolicy.DROP_NEW));
        assertTrue(q.enqueue(1));
        assertTrue(q.enqueue(2));
        assertFalse(q.enqueue(3));
        assertEquals(List.of(1, 2), q.snapshot());
    }

    @Test
    void throw_policy_raises_and_closes_the_queue() {
        BackpressureQueue<Integer> q = new BackpressureQueue<>(QueueConfig.bounded(1, OverflowPolicy.THROW));
        q.enqueue(1);
        assertThrows(QueueOverflowException.class, () -> q.enqueue(2));
        assertTrue(q.isEnded());
        assertFalse(q.enqueue(3));
        assertThrows(QueueOverflowException.class, q::next);
    }

    @Test
    void waiting_consumer_is_handed_the_item_directly() throws Exception {
        BackpressureQueue<String> q = new BackpressureQueue<>(QueueConfig.bounded(1, OverflowPolicy.THROW));
        CompletableFuture<Pull<String>> pending = q.nextAsync();
        assertFalse(pending.isDone());
        q.enqueue("a");
        assertEquals("a", pending.get(1, TimeUnit.SECONDS).value());
        assertEquals(0, q.size());
    }

    @Test
    void end_drains_buffer_then_reports_done() {
        BackpressureQueue<Integer> q = new BackpressureQueue<>();
        q.enqueue(1);
        q.enqueue(2);
        q.end();
        q.end();
        assertFalse(q.enqueue(3));
        assertEquals(Optional.of(1), q.next());
        assertEquals(Optional.of(2), q.next());
        assertEquals(Optional.empty(), q.next());
    }

    @Test
    void end_resolves_every_pending_consumer() {
        BackpressureQueue<Integer> q = new BackpressureQueue<>();
        CompletableFuture<Pull<Integer>> a = q.nextAsync();
        CompletableFuture<Pull<Integer>> b = q.nextAsync();
        q.end();
        assertTrue(a.join().isEnd());
        assertTrue(b.join().isEnd());
    }

    @Test
    void end_with_error_fails_pending_consumers() {
        BackpressureQueue<Integer> q = new BackpressureQueue<>();
        CompletableFuture<Pull<Integer>> a = q.nextAsync();
        q.end(new IllegalStateException("source broke"));
        CompletionException e = assertThrows(CompletionException.class, a::join);
        assertEquals("source broke", e.getCause().getMessage());
    }

    @Test
    void checked_end_error_surfaces_as_upstream_failure() {
        BackpressureQueue<Integer> q = new BackpressureQueue<>();
        IOException io = new IOException("disk gone");
        q.end(io);
        UpstreamFailureException e = assertThrows(UpstreamFailureException.class, q::next);
        assertEquals("UPSTREAM_FAILURE", e.code());
        assertSame(io, e.getCause());
    }

    @Test
    void blocked_consumer_wakes_on_enqueue_from_another_thread() {
        BackpressureQueue<Integer> q = new BackpressureQueue<>();
        new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            q.enqueue(7);
        }).start();
        assertEquals(Optional.of(7), q.next());
    }

    @Test
    void poll_times_out_without_losing_later_items() {
        BackpressureQueue<Integer> q = new BackpressureQueue<>();
        assertTrue(q.poll(20, TimeUnit.MILLISECONDS).isTimeout());
        q.enqueue(1);
        assertEquals(1, q.poll(20, TimeUnit.MILLISECONDS).value());
        q.end();
        assertTrue(q.poll(20, TimeUnit.MILLISECONDS).isEnd());
    }

    @Test
    void cancellation_releases_upstream_before_failing_consumers() {
        CancellationToken token = new CancellationToken();
        BackpressureQueue<Integer> q = new BackpressureQueue<>(QueueConfig.UNBOUNDED.withToken(token));
        List<String> order = new ArrayList<>();
        q.bindUpstream(() -> order.add("upstream released"));
        CompletableFuture<Pull<Integer>> pending = q.nextAsync();
        pending.whenComplete((v, e) -> order.add("consumer " + (e != null ? "failed" : "resolved")));

        token.cancel();
        token.cancel();

        assertEquals(List.of("upstream released", "consumer failed"), order);
        assertTrue(q.isEnded());
        assertThrows(OperationAbortedException.class, q::next);
    }

    @Test
    void binding_after_end_releases_immediately() {
        BackpressureQueue<Integer> q = new BackpressureQueue<>();
        q.end();
        List<String> released = new ArrayList<>();
        q.bindUpstream(() -> released.add("x"));
        assertEquals(List.of("x"), released);
    }

    @Test
    void registers_depth_and_dropped_gauges() {
        MetricRegistry registry = new MetricRegistry();
        BackpressureQueue<Integer> q = new BackpressureQueue<>(QueueConfig.bounded(1, OverflowPolicy.DROP_NEW));
        q.registerMetrics(registry, "events");
        q.enqueue(1);
        q.enqueue(2);
        Gauge<?> depth = registry.getGauges().get("queue.events.depth");
        Gauge<?> dropped = registry.getGauges().get("queue.events.dropped");
        assertEquals(1, depth.getValue());
        assertEquals(1L, dropped.getValue());
    }
}
