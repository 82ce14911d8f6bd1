package io.streamkit.sequence;

import io.streamkit.core.CancellationToken;
import io.streamkit.core.Schedulers;
import io.streamkit.error.OperationAbortedException;
import io.streamkit.error.RetryExhaustedException;
import io.streamkit.error.UpstreamFailureException;
import io.streamkit.queue.QueueConfig;
import io.streamkit.stream.EventSource;
import io.streamkit.stream.EventStream;
import io.streamkit.stream.Listener;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

public class SequencesTest {
    @Test
    void sequences_are_re_openable() {
        Sequence<Integer> s = Sequences.of(1, 2);
        assertEquals(List.of(1, 2), s.toList());
        assertEquals(List.of(1, 2), s.toList());
        assertEquals(Optional.of(1), s.first());
        assertEquals(Optional.empty(), Sequences.<Integer>empty().first());
    }

    @Test
    void interval_counts_and_honours_cancellation() {
        assertEquals(List.of(0L, 1L, 2L), Sequences.fromInterval(1, 3, null).toList());
        CancellationToken token = new CancellationToken();
        Cursor<Long> c = Sequences.fromInterval(10_000, 5, token).open();
        assertEquals(Optional.of(0L), c.next());
        Schedulers.timer().schedule(token::cancel, 30, TimeUnit.MILLISECONDS);
        assertThrows(OperationAbortedException.class, c::next);
    }

    @Test
    void future_source_yields_value_or_cause() {
        assertEquals(List.of("done"), Sequences.fromFuture(CompletableFuture.completedFuture("done")).toList());
        CompletableFuture<String> failed = CompletableFuture.failedFuture(new IllegalStateException("nope"));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Sequences.fromFuture(failed).toList());
        assertEquals("nope", e.getMessage());
    }

    @Test
    void future_failing_with_checked_cause_raises_upstream_failure() {
        IOException io = new IOException("socket closed");
        CompletableFuture<String> failed = CompletableFuture.failedFuture(io);
        UpstreamFailureException e = assertThrows(UpstreamFailureException.class, () -> Sequences.fromFuture(failed).toList());
        assertEquals("UPSTREAM_FAILURE", e.code());
        assertSame(io, e.getCause());
    }

    @Test
    void event_stream_values_are_buffered_until_completion() {
        EventStream<String> stream = EventStream.create();
        Cursor<String> c = Sequences.fromEventStream(stream).open();
        assertEquals(1, stream.listenerCount());
        stream.emit("a");
        stream.emit("b");
        stream.complete();
        assertEquals(Optional.of("a"), c.next());
        assertEquals(Optional.of("b"), c.next());
        assertEquals(Optional.empty(), c.next());
    }

    @Test
    void closing_the_cursor_unsubscribes_from_the_stream() {
        EventStream<String> stream = EventStream.create();
        Cursor<String> c = Sequences.fromEventStream(stream).open();
        c.close();
        assertEquals(0, stream.listenerCount());
    }

    @Test
    void event_source_listener_is_removed_on_cancellation() {
        List<Consumer<? super Integer>> registered = new CopyOnWriteArrayList<>();
        EventSource<Integer> emitter = listener -> {
            registered.add(listener);
            return () -> registered.remove(listener);
        };
        CancellationToken token = new CancellationToken();
        Cursor<Integer> c = Sequences.fromEventSource(emitter, QueueConfig.UNBOUNDED.withToken(token)).open();
        registered.get(0).accept(5);
        assertEquals(Optional.of(5), c.next());
        token.cancel();
        assertTrue(registered.isEmpty());
        assertThrows(OperationAbortedException.class, c::next);
    }

    @Test
    void retrying_recreates_the_source() {
        AtomicInteger created = new AtomicInteger();
        Sequence<String> s = Sequences.retrying(() -> created.incrementAndGet() < 2
                ? Sequences.<String>failed(new IllegalStateException("first"))
                : Sequences.of("ok"), 3, 1);
        assertEquals(List.of("ok"), s.toList());
        assertEquals(2, created.get());

        Sequence<String> hopeless = Sequences.retrying(() -> Sequences.<String>failed(new IllegalStateException("x")), 2, 1);
        assertEquals(2, assertThrows(RetryExhaustedException.class, hopeless::toList).attempts());
    }

    @Test
    void sequence_can_feed_an_event_stream() throws Exception {
        List<Integer> out = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        Sequences.toEventStream(Sequences.of(1, 2, 3))
                .subscribe(Listener.observer(out::add, null, done::countDown));
        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertEquals(List.of(1, 2, 3), out);
    }
}
