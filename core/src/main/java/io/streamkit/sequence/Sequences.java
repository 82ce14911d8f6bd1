package io.streamkit.sequence;

import io.streamkit.core.CancellationToken;
import io.streamkit.core.Schedulers;
import io.streamkit.error.FailureReporter;
import io.streamkit.error.LoggingFailureReporter;
import io.streamkit.error.OperationAbortedException;
import io.streamkit.error.UpstreamFailureException;
import io.streamkit.error.ValidationException;
import io.streamkit.queue.BackpressureQueue;
import io.streamkit.queue.QueueConfig;
import io.streamkit.retry.ExponentialBackoffRetryPolicy;
import io.streamkit.stream.EventSource;
import io.streamkit.stream.EventStream;
import io.streamkit.stream.Listener;
import io.streamkit.stream.Subscription;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Sequence sources, and the bridges between sequences and event streams.
 */
public final class Sequences {
    private Sequences() {}

    @SafeVarargs
    public static <T> Sequence<T> of(T... values) {
        return fromIterable(List.of(values));
    }

    public static <T> Sequence<T> fromIterable(Iterable<? extends T> values) {
        Objects.requireNonNull(values, "values");
        return () -> Cursor.fromIterator(values.iterator());
    }

    public static <T> Sequence<T> empty() {
        return () -> Cursor.of(Optional::empty, () -> {});
    }

    /** A sequence whose every run fails immediately with {@code error}. */
    public static <T> Sequence<T> failed(RuntimeException error) {
        Objects.requireNonNull(error, "error");
        return () -> Cursor.of(() -> { throw error; }, () -> {});
    }

    /** Opens {@code factory}'s sequence anew for every run. */
    public static <T> Sequence<T> defer(Supplier<? extends Sequence<? extends T>> factory) {
        Objects.requireNonNull(factory, "factory");
        return () -> {
            Cursor<? extends T> c = factory.get().open();
            return Cursor.of(() -> c.next().map(v -> (T) v), c::close);
        };
    }

    public static Sequence<Long> fromInterval(long periodMs) {
        return fromInterval(periodMs, Long.MAX_VALUE, null);
    }

    /**
     * Emits 0, 1, ... {@code count - 1}, waiting {@code periodMs} between values. Cancelling {@code token}
     * aborts the run with {@link OperationAbortedException}.
     */
    public static Sequence<Long> fromInterval(long periodMs, long count, CancellationToken token) {
        ValidationException.requireNonNegative(periodMs, "periodMs");
        ValidationException.requireNonNegative(count, "count");
        return () -> {
            long[] i = {0};
            return Cursor.of(() -> {
                if (i[0] >= count) return Optional.empty();
                if (token != null) token.throwIfCancelled();
                if (i[0] > 0) CancellationToken.sleep(token, periodMs);
                return Optional.of(i[0]++);
            }, () -> {});
        };
    }

    /** The future's value as a one-element sequence; a failed future fails the run with its cause. */
    public static <T> Sequence<T> fromFuture(CompletionStage<? extends T> future) {
        Objects.requireNonNull(future, "future");
        return () -> {
            boolean[] consumed = {false};
            return Cursor.of(() -> {
                if (consumed[0]) return Optional.empty();
                consumed[0] = true;
                return Optional.of(await(future.toCompletableFuture()));
            }, () -> {});
        };
    }

    public static <T> Sequence<T> fromEventStream(EventStream<T> stream) {
        return fromEventStream(stream, QueueConfig.UNBOUNDED);
    }

    /**
     * Subscribes to {@code stream} for every run and buffers its values in a {@link BackpressureQueue}. The run
     * ends when the stream completes; closing the run unsubscribes.
     */
    public static <T> Sequence<T> fromEventStream(EventStream<T> stream, QueueConfig config) {
        Objects.requireNonNull(stream, "stream");
        Objects.requireNonNull(config, "config");
        return () -> {
            BackpressureQueue<T> queue = new BackpressureQueue<>(config);
            Subscription sub = stream.subscribe(Listener.observer(queue::enqueue, queue::end, queue::end));
            queue.bindUpstream(sub);
            return Cursor.of(queue::next, queue::close);
        };
    }

    public static <T> Sequence<T> fromEventSource(EventSource<T> source) {
        return fromEventSource(source, QueueConfig.UNBOUNDED);
    }

    /**
     * Registers on {@code source} for every run. The run only ends through the queue's cancellation token, an
     * overflow under {@code THROW}, or closing the cursor, each of which deregisters the listener.
     */
    public static <T> Sequence<T> fromEventSource(EventSource<T> source, QueueConfig config) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(config, "config");
        return () -> {
            BackpressureQueue<T> queue = new BackpressureQueue<>(config);
            queue.bindUpstream(source.addListener(queue::enqueue));
            return Cursor.of(queue::next, queue::close);
        };
    }

    /** Re-creates the sequence after a failure, up to {@code attempts} runs, {@code delayMs} apart. */
    public static <T> Sequence<T> retrying(Supplier<? extends Sequence<? extends T>> factory, int attempts, long delayMs) {
        RetryOptions options = RetryOptions.of(ExponentialBackoffRetryPolicy.fixed(attempts, delayMs));
        return Sequences.<T>defer(factory).pipe(Operators.retry(options));
    }

    public static <T> EventStream<T> toEventStream(Sequence<T> sequence) {
        return toEventStream(sequence, Schedulers.pumps(), LoggingFailureReporter.INSTANCE);
    }

    /**
     * Pumps one run of {@code sequence} into a stream per attachment. The stream completes when the run ends;
     * a run failure goes to {@code reporter} and completes the stream as well.
     */
    public static <T> EventStream<T> toEventStream(Sequence<T> sequence, ExecutorService executor, FailureReporter reporter) {
        Objects.requireNonNull(sequence, "sequence");
        return EventStream.connected(Schedulers.timer(), reporter, downstream -> {
            Pump pump = Pump.start(sequence, new Pump.Sink<T>() {
                @Override
                public boolean value(T value) {
                    downstream.emit(value);
                    return !downstream.isCompleted();
                }

                @Override
                public void end() { downstream.complete(); }

                @Override
                public void fail(RuntimeException error) {
                    reporter.report("sequence", null, error);
                    downstream.complete();
                }
            }, executor);
            return pump::close;
        });
    }

    private static <T> T await(Future<? extends T> future) {
        try {
            return Objects.requireNonNull(future.get(), "future produced null");
        } catch (InterruptedException e) {
            throw OperationAbortedException.interrupted(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new UpstreamFailureException(cause);
        }
    }
}
