package io.streamkit.stream;

import io.streamkit.core.Schedulers;
import io.streamkit.error.ValidationException;
import io.streamkit.ratelimit.TokenBucketRateLimiter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Push-mode operators. Each derived stream attaches to its source when it gains its first listener, detaches
 * when it loses its last one, and completes when the source completes. Operator state lives per attachment.
 */
public final class StreamOperators {
    private StreamOperators() {}

    public static <T, R> StreamOperator<T, R> map(Function<? super T, ? extends R> fn) {
        Objects.requireNonNull(fn, "fn");
        return source -> derive(source, downstream -> forward(source, downstream, v -> downstream.emit(fn.apply(v))));
    }

    public static <T> StreamOperator<T, T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return source -> derive(source, downstream -> forward(source, downstream, v -> {
            if (predicate.test(v)) downstream.emit(v);
        }));
    }

    /** Emits the first {@code count} values, then completes. {@code take(0)} completes on first subscription. */
    public static <T> StreamOperator<T, T> take(int count) {
        ValidationException.requireNonNegative(count, "count");
        return source -> derive(source, downstream -> {
            if (count == 0) {
                downstream.complete();
                return null;
            }
            AtomicInteger taken = new AtomicInteger();
            return forward(source, downstream, v -> {
                int n = taken.incrementAndGet();
                if (n > count) return;
                downstream.emit(v);
                if (n == count) downstream.complete();
            });
        });
    }

    public static <T> StreamOperator<T, T> skip(int count) {
        ValidationException.requireNonNegative(count, "count");
        return source -> derive(source, downstream -> {
            AtomicLong seen = new AtomicLong();
            return forward(source, downstream, v -> {
                if (seen.incrementAndGet() > count) downstream.emit(v);
            });
        });
    }

    public static <T> StreamOperator<T, T> debounceTime(long waitMs) {
        return debounceTime(waitMs, Schedulers.timer());
    }

    /**
     * Emits a value once {@code waitMs} passed without a newer one. A pending value is dropped when the source
     * completes or the last listener leaves.
     */
    public static <T> StreamOperator<T, T> debounceTime(long waitMs, ScheduledExecutorService scheduler) {
        ValidationException.requireNonNegative(waitMs, "waitMs");
        Objects.requireNonNull(scheduler, "scheduler");
        return source -> derive(source, downstream -> {
            AtomicReference<ScheduledFuture<?>> pending = new AtomicReference<>();
            Runnable clear = () -> {
                ScheduledFuture<?> f = pending.getAndSet(null);
                if (f != null) f.cancel(false);
            };
            Subscription upstream = source.subscribe(Listener.observer(v -> {
                ScheduledFuture<?> next = scheduler.schedule(() -> downstream.emit(v), waitMs, TimeUnit.MILLISECONDS);
                ScheduledFuture<?> prev = pending.getAndSet(next);
                if (prev != null) prev.cancel(false);
            }, null, () -> {
                clear.run();
                downstream.complete();
            }));
            return () -> {
                clear.run();
                upstream.unsubscribe();
            };
        });
    }

    /** Values from this stream and {@code others}; completes once every input completed. */
    @SafeVarargs
    public static <T> StreamOperator<T, T> mergeWith(EventStream<T>... others) {
        List<EventStream<T>> rest = List.of(others);
        return source -> {
            List<EventStream<T>> all = new ArrayList<>(rest.size() + 1);
            all.add(source);
            all.addAll(rest);
            return EventStreams.merge(all);
        };
    }

    /** Forwards only the values the limiter admits; denied values are dropped. */
    public static <T> StreamOperator<T, T> rateLimit(TokenBucketRateLimiter limiter) {
        Objects.requireNonNull(limiter, "limiter");
        return source -> derive(source, downstream -> forward(source, downstream, v -> {
            if (limiter.consume().allowed()) downstream.emit(v);
        }));
    }

    static <T, R> EventStream<R> derive(EventStream<T> source, EventStream.Connector<R> connector) {
        return EventStream.connected(source.dispatcher(), source.reporter(), connector);
    }

    /** Subscribes {@code onValue} to {@code source}, completing {@code downstream} with it. */
    static <T, R> Runnable forward(EventStream<T> source, EventStream<R> downstream, java.util.function.Consumer<T> onValue) {
        Subscription upstream = source.subscribe(Listener.observer(onValue, null, downstream::complete));
        return upstream::unsubscribe;
    }
}
