package io.streamkit.stream;

import io.streamkit.core.Schedulers;
import io.streamkit.error.LoggingFailureReporter;
import io.streamkit.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Stream sources. Each starts producing when its first listener subscribes. */
public final class EventStreams {
    private EventStreams() {}

    @SafeVarargs
    public static <T> EventStream<T> of(T... values) {
        return fromIterable(List.of(values));
    }

    public static <T> EventStream<T> fromIterable(Iterable<? extends T> values) {
        return fromIterable(values, Schedulers.timer());
    }

    /**
     * Emits {@code values} on {@code executor} after the first subscription, then completes. Emission stops early
     * once every listener left.
     */
    public static <T> EventStream<T> fromIterable(Iterable<? extends T> values, Executor executor) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(executor, "executor");
        return EventStream.connected(executor, LoggingFailureReporter.INSTANCE, downstream -> {
            AtomicBoolean stopped = new AtomicBoolean();
            executor.execute(() -> {
                for (T v : values) {
                    if (stopped.get() || downstream.isCompleted()) return;
                    downstream.emit(v);
                }
                downstream.complete();
            });
            return () -> stopped.set(true);
        });
    }

    public static EventStream<Long> interval(long periodMs) {
        return interval(periodMs, Schedulers.timer());
    }

    /** Emits 0, 1, 2, ... every {@code periodMs}; the schedule is cancelled when the last listener leaves. */
    public static EventStream<Long> interval(long periodMs, ScheduledExecutorService scheduler) {
        ValidationException.requirePositive(periodMs, "periodMs");
        Objects.requireNonNull(scheduler, "scheduler");
        return EventStream.connected(scheduler, LoggingFailureReporter.INSTANCE, downstream -> {
            AtomicLong tick = new AtomicLong();
            ScheduledFuture<?> task = scheduler.scheduleAtFixedRate(
                    () -> downstream.emit(tick.getAndIncrement()), periodMs, periodMs, TimeUnit.MILLISECONDS);
            return () -> task.cancel(false);
        });
    }

    /**
     * Bridges an external emitter. The stream registers on its first subscriber and deregisters when the
     * listener set empties or the stream completes.
     */
    public static <T> EventStream<T> fromEventSource(EventSource<T> source) {
        Objects.requireNonNull(source, "source");
        return EventStream.connected(downstream -> {
            AutoCloseable registration = source.addListener(downstream::emit);
            return () -> {
                try {
                    registration.close();
                } catch (Exception e) {
                    downstream.reporter().report("event-source-close", null, e);
                }
            };
        });
    }

    @SafeVarargs
    public static <T> EventStream<T> merge(EventStream<T>... streams) {
        return merge(List.of(streams));
    }

    /** Values from every input as they arrive; completes once all inputs completed. */
    public static <T> EventStream<T> merge(List<EventStream<T>> streams) {
        List<EventStream<T>> inputs = List.copyOf(streams);
        EventStream.Connector<T> connector = downstream -> {
            if (inputs.isEmpty()) {
                downstream.complete();
                return null;
            }
            AtomicInteger remaining = new AtomicInteger(inputs.size());
            List<Subscription> subs = new ArrayList<>(inputs.size());
            for (EventStream<T> input : inputs) {
                subs.add(input.subscribe(Listener.observer(downstream::emit, null, () -> {
                    if (remaining.decrementAndGet() == 0) downstream.complete();
                })));
            }
            return () -> subs.forEach(Subscription::unsubscribe);
        };
        if (inputs.isEmpty()) return EventStream.connected(connector);
        EventStream<T> first = inputs.get(0);
        return EventStream.connected(first.dispatcher(), first.reporter(), connector);
    }
}
