package io.streamkit.sequence;

import io.streamkit.core.Schedulers;
import io.streamkit.error.BatchOperationException;
import io.streamkit.error.OperationAbortedException;
import io.streamkit.error.OperatorTimeoutException;
import io.streamkit.error.UpstreamFailureException;
import io.streamkit.error.ValidationException;
import io.streamkit.queue.BackpressureQueue;
import io.streamkit.queue.Pull;
import io.streamkit.queue.QueueConfig;
import io.streamkit.ratelimit.TokenBucketRateLimiter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Operators driven by time or by a decoupled producer. Their upstream runs on a pump thread, so a slow or
 * silent source never stalls the deadline; closing the cursor stops the pump.
 */
public final class TimedOperators {
    private TimedOperators() {}

    /**
     * Emits a value once {@code waitMs} passed without a newer one. A value still pending when the source ends
     * is flushed.
     */
    public static <T> SequenceOperator<T, T> debounceTime(long waitMs) {
        ValidationException.requireNonNegative(waitMs, "waitMs");
        long waitNanos = TimeUnit.MILLISECONDS.toNanos(waitMs);
        return source -> () -> new PumpedCursor<T, T>(List.of(source), null, Schedulers.pumps()) {
            private T pending;
            private long deadline;
            private boolean ended;

            @Override
            public Optional<T> next() {
                while (true) {
                    if (ended) return Optional.ofNullable(releasePending());
                    Signal<T> s;
                    if (pending == null) {
                        s = take();
                        if (s == null) return Optional.empty();
                    } else {
                        Pull<Signal<T>> p = poll(deadline - System.nanoTime());
                        if (p.isTimeout()) return Optional.of(releasePending());
                        if (p.isEnd()) return Optional.empty();
                        s = p.value();
                    }
                    if (s.error() != null) throw s.error();
                    if (s.end()) {
                        ended = true;
                        continue;
                    }
                    pending = s.value();
                    deadline = System.nanoTime() + waitNanos;
                }
            }

            private T releasePending() {
                T v = pending;
                pending = null;
                return v;
            }
        };
    }

    public static <T> SequenceOperator<T, T> throttleTime(long windowMs) {
        return throttleTime(windowMs, ThrottleOptions.DEFAULT);
    }

    /**
     * At most one value per window of {@code windowMs}. A value arriving at least a window after the last
     * emission opens a new window and is emitted at once if {@code leading}; later values in the window replace
     * each other and the survivor is emitted when the window closes if {@code trailing}.
     */
    public static <T> SequenceOperator<T, T> throttleTime(long windowMs, ThrottleOptions options) {
        ValidationException.requireNonNegative(windowMs, "windowMs");
        Objects.requireNonNull(options, "options");
        long windowNanos = TimeUnit.MILLISECONDS.toNanos(windowMs);
        return source -> () -> new PumpedCursor<T, T>(List.of(source), null, Schedulers.pumps()) {
            private boolean windowOpen;
            private long windowStart;
            private T pending;
            private Signal<T> stashed;
            private boolean ended;

            @Override
            public Optional<T> next() {
                while (true) {
                    if (ended) return Optional.ofNullable(releasePending(System.nanoTime()));
                    Signal<T> s;
                    if (stashed != null) {
                        s = stashed;
                        stashed = null;
                    } else if (pending == null) {
                        s = take();
                        if (s == null) return Optional.empty();
                    } else {
                        Pull<Signal<T>> p = poll(windowStart + windowNanos - System.nanoTime());
                        if (p.isTimeout()) return Optional.of(releasePending(System.nanoTime()));
                        if (p.isEnd()) return Optional.empty();
                        s = p.value();
                    }
                    if (s.error() != null) throw s.error();
                    if (s.end()) {
                        ended = true;
                        continue;
                    }
                    long now = System.nanoTime();
                    boolean windowClosed = !windowOpen || now - windowStart >= windowNanos;
                    if (windowClosed && pending != null) {
                        // the window closed while this value was in flight
                        stashed = s;
                        return Optional.of(releasePending(now));
                    }
                    if (windowClosed) {
                        windowOpen = true;
                        windowStart = now;
                        if (options.leading()) return Optional.of(s.value());
                    }
                    if (options.trailing()) pending = s.value();
                }
            }

            private T releasePending(long now) {
                T v = pending;
                if (v != null) {
                    pending = null;
                    windowStart = now;
                }
                return v;
            }
        };
    }

    public static <T> SequenceOperator<T, List<T>> batch(int size) {
        return batch(size, BatchOptions.NONE);
    }

    /**
     * Groups values into lists of {@code size}, flushing early once {@code timeoutMs} passed since the first
     * buffered item. Remaining items are flushed when the source ends. An upstream failure while items are
     * buffered surfaces as {@link BatchOperationException} carrying them.
     */
    public static <T> SequenceOperator<T, List<T>> batch(int size, BatchOptions options) {
        ValidationException.requirePositive(size, "size");
        Objects.requireNonNull(options, "options");
        if (options.timeoutMs() == 0 && options.token() == null) {
            return source -> () -> {
                Cursor<T> up = source.open();
                return Cursor.of(() -> {
                    List<T> buf = new ArrayList<>(size);
                    try {
                        for (Optional<T> v = up.next(); v.isPresent(); v = up.next()) {
                            buf.add(v.get());
                            if (buf.size() == size) break;
                        }
                    } catch (RuntimeException e) {
                        throw batchFailure(buf, e);
                    }
                    return buf.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(buf));
                }, up::close);
            };
        }
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(options.timeoutMs());
        return source -> () -> new PumpedCursor<T, List<T>>(List.of(source), options.token(), Schedulers.pumps()) {
            private final List<T> buf = new ArrayList<>(size);
            private long deadline;
            private boolean ended;

            @Override
            public Optional<List<T>> next() {
                if (ended) return Optional.empty();
                while (true) {
                    Signal<T> s;
                    if (buf.isEmpty() || timeoutNanos == 0) {
                        s = take();
                        if (s == null) return Optional.empty();
                    } else {
                        Pull<Signal<T>> p = poll(deadline - System.nanoTime());
                        if (p.isTimeout()) return Optional.of(flush());
                        if (p.isEnd()) return Optional.empty();
                        s = p.value();
                    }
                    if (s.error() != null) {
                        ended = true;
                        throw batchFailure(buf, s.error());
                    }
                    if (s.end()) {
                        ended = true;
                        return buf.isEmpty() ? Optional.empty() : Optional.of(flush());
                    }
                    if (buf.isEmpty()) deadline = System.nanoTime() + timeoutNanos;
                    buf.add(s.value());
                    if (buf.size() >= size) return Optional.of(flush());
                }
            }

            private List<T> flush() {
                List<T> out = List.copyOf(buf);
                buf.clear();
                return out;
            }
        };
    }

    /** Fails with {@link OperatorTimeoutException} when no value or end arrives within {@code timeoutMs}. */
    public static <T> SequenceOperator<T, T> timeout(long timeoutMs) {
        ValidationException.requirePositive(timeoutMs, "timeoutMs");
        return source -> () -> new PumpedCursor<T, T>(List.of(source), null, Schedulers.pumps()) {
            private boolean done;

            @Override
            public Optional<T> next() {
                if (done) return Optional.empty();
                Pull<Signal<T>> p = poll(TimeUnit.MILLISECONDS.toNanos(timeoutMs));
                if (p.isTimeout()) {
                    done = true;
                    close();
                    throw new OperatorTimeoutException(timeoutMs);
                }
                if (p.isEnd()) return Optional.empty();
                Signal<T> s = p.value();
                if (s.error() != null) throw s.error();
                if (s.end()) {
                    done = true;
                    return Optional.empty();
                }
                return Optional.of(s.value());
            }
        };
    }

    /**
     * Decouples producer and consumer through a {@link BackpressureQueue}: the source is drained eagerly on a
     * pump thread and the configured overflow policy decides what happens when the consumer falls behind.
     */
    public static <T> SequenceOperator<T, T> withQueue(QueueConfig config) {
        Objects.requireNonNull(config, "config");
        return source -> () -> {
            BackpressureQueue<T> queue = new BackpressureQueue<>(config);
            Pump pump = Pump.start(source, new Pump.Sink<T>() {
                @Override
                public boolean value(T value) {
                    queue.enqueue(value);
                    return !queue.isEnded();
                }

                @Override
                public void end() { queue.end(); }

                @Override
                public void fail(RuntimeException error) { queue.end(error); }
            }, Schedulers.pumps());
            queue.bindUpstream(pump);
            return Cursor.of(queue::next, queue::close);
        };
    }

    /** Waits for a permit from {@code limiter} before handing each value downstream. */
    public static <T> SequenceOperator<T, T> rateLimit(TokenBucketRateLimiter limiter) {
        Objects.requireNonNull(limiter, "limiter");
        return source -> () -> {
            Cursor<T> up = source.open();
            return Cursor.of(() -> {
                Optional<T> v = up.next();
                if (v.isPresent()) await(limiter);
                return v;
            }, up::close);
        };
    }

    private static void await(TokenBucketRateLimiter limiter) {
        CompletableFuture<Void> permit = limiter.acquire().toCompletableFuture();
        try {
            permit.get();
        } catch (InterruptedException e) {
            // stop the pending retries so no token is spent for a value that is never delivered
            permit.cancel(false);
            throw OperationAbortedException.interrupted(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new UpstreamFailureException(cause);
        }
    }

    private static RuntimeException batchFailure(List<?> buffered, RuntimeException cause) {
        if (buffered.isEmpty() || cause instanceof OperationAbortedException) return cause;
        return new BatchOperationException("Batch failed with " + buffered.size() + " buffered item(s)", buffered, cause);
    }
}
