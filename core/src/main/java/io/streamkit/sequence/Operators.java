package io.streamkit.sequence;

import io.streamkit.core.CancellationToken;
import io.streamkit.error.OperationAbortedException;
import io.streamkit.error.RetryExhaustedException;
import io.streamkit.error.ValidationException;
import io.streamkit.retry.ExponentialBackoffRetryPolicy;
import io.streamkit.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Operators that run entirely on the consuming thread.
 */
public final class Operators {
    private static final Logger log = LoggerFactory.getLogger(Operators.class);

    private Operators() {}

    public static <T, R> SequenceOperator<T, R> map(Function<? super T, ? extends R> fn) {
        Objects.requireNonNull(fn, "fn");
        return source -> () -> {
            Cursor<T> up = source.open();
            return Cursor.of(() -> up.next().map(v -> Objects.requireNonNull(fn.apply(v), "map produced null")), up::close);
        };
    }

    public static <T> SequenceOperator<T, T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return source -> () -> {
            Cursor<T> up = source.open();
            return Cursor.of(() -> {
                for (Optional<T> v = up.next(); v.isPresent(); v = up.next()) {
                    if (predicate.test(v.get())) return v;
                }
                return Optional.empty();
            }, up::close);
        };
    }

    /** First {@code n} values; the upstream run is closed as soon as the last one was taken. */
    public static <T> SequenceOperator<T, T> take(int n) {
        ValidationException.requireNonNegative(n, "n");
        return source -> () -> {
            if (n == 0) return Cursor.fromIterator(List.<T>of().iterator());
            Cursor<T> up = source.open();
            int[] taken = {0};
            return Cursor.of(() -> {
                if (taken[0] >= n) return Optional.empty();
                Optional<T> v = up.next();
                if (v.isPresent() && ++taken[0] == n) up.close();
                return v;
            }, up::close);
        };
    }

    public static <T> SequenceOperator<T, T> skip(int n) {
        ValidationException.requireNonNegative(n, "n");
        return source -> () -> {
            Cursor<T> up = source.open();
            int[] skipped = {0};
            return Cursor.of(() -> {
                while (skipped[0] < n) {
                    if (up.next().isEmpty()) return Optional.empty();
                    skipped[0]++;
                }
                return up.next();
            }, up::close);
        };
    }

    /** Emits the running accumulation for every value; the seed itself is not emitted. */
    public static <T, A> SequenceOperator<T, A> scan(BiFunction<? super A, ? super T, ? extends A> reducer, A seed) {
        Objects.requireNonNull(reducer, "reducer");
        return source -> () -> {
            Cursor<T> up = source.open();
            List<A> acc = new ArrayList<>(1);
            acc.add(seed);
            return Cursor.of(() -> up.next().map(v -> {
                A next = Objects.requireNonNull(reducer.apply(acc.get(0), v), "scan produced null");
                acc.set(0, next);
                return next;
            }), up::close);
        };
    }

    public static <T> SequenceOperator<T, T> distinctUntilChanged() {
        return distinctUntilChanged(Objects::equals);
    }

    /** Drops values equal to the previously emitted one. */
    public static <T> SequenceOperator<T, T> distinctUntilChanged(BiPredicate<? super T, ? super T> equals) {
        Objects.requireNonNull(equals, "equals");
        return source -> () -> {
            Cursor<T> up = source.open();
            List<T> previous = new ArrayList<>(1);
            return Cursor.of(() -> {
                for (Optional<T> v = up.next(); v.isPresent(); v = up.next()) {
                    if (previous.isEmpty()) {
                        previous.add(v.get());
                        return v;
                    }
                    if (!equals.test(previous.get(0), v.get())) {
                        previous.set(0, v.get());
                        return v;
                    }
                }
                return Optional.empty();
            }, up::close);
        };
    }

    /** Consecutive chunks of {@code size}; the last chunk may be shorter. */
    public static <T> SequenceOperator<T, List<T>> buffer(int size) {
        ValidationException.requirePositive(size, "size");
        return source -> () -> {
            Cursor<T> up = source.open();
            return Cursor.of(() -> {
                List<T> chunk = new ArrayList<>(size);
                for (Optional<T> v = up.next(); v.isPresent(); v = up.next()) {
                    chunk.add(v.get());
                    if (chunk.size() == size) return Optional.of(List.copyOf(chunk));
                }
                return chunk.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(chunk));
            }, up::close);
        };
    }

    public static <T> SequenceOperator<T, List<T>> window(int size, int slide) {
        return window(size, slide, null);
    }

    /**
     * Complete windows of {@code size} values whose start advances by {@code slide}. A trailing window shorter
     * than {@code size} is never emitted. With {@code slide > size} the values between windows are skipped.
     */
    public static <T> SequenceOperator<T, List<T>> window(int size, int slide, CancellationToken token) {
        ValidationException.requirePositive(size, "size");
        ValidationException.requirePositive(slide, "slide");
        return source -> () -> {
            Cursor<T> up = source.open();
            ArrayDeque<T> buf = new ArrayDeque<>(size);
            int[] toSkip = {0};
            return Cursor.of(() -> {
                for (Optional<T> v = up.next(); v.isPresent(); v = up.next()) {
                    if (token != null) token.throwIfCancelled();
                    if (toSkip[0] > 0) {
                        toSkip[0]--;
                        continue;
                    }
                    buf.addLast(v.get());
                    if (buf.size() == size) {
                        List<T> out = List.copyOf(buf);
                        for (int i = 0; i < slide && !buf.isEmpty(); i++) buf.pollFirst();
                        toSkip[0] = Math.max(0, slide - size);
                        return Optional.of(out);
                    }
                }
                return Optional.empty();
            }, up::close);
        };
    }

    public static <T> SequenceOperator<T, T> retry(int maxAttempts) {
        return retry(RetryOptions.of(ExponentialBackoffRetryPolicy.DEFAULT.withMaxAttempts(maxAttempts)));
    }

    /**
     * Re-opens the source after a failure, waiting the policy's backoff first. Values delivered before a failure
     * are not taken back. Gives up with {@link RetryExhaustedException} after the last attempt, on an error the
     * policy does not retry, or on cancellation.
     */
    public static <T> SequenceOperator<T, T> retry(RetryOptions options) {
        Objects.requireNonNull(options, "options");
        RetryPolicy policy = options.policy();
        CancellationToken token = options.token();
        return source -> () -> new Cursor<>() {
            private int attempt = 1;
            private Cursor<T> current;
            private boolean done;

            @Override
            public Optional<T> next() {
                while (!done) {
                    try {
                        if (current == null) current = source.open();
                        Optional<T> v = current.next();
                        if (v.isEmpty()) close();
                        return v;
                    } catch (RuntimeException e) {
                        closeCurrent();
                        giveUpOrWait(e);
                        attempt++;
                    }
                }
                return Optional.empty();
            }

            private void giveUpOrWait(RuntimeException e) {
                if ((token != null && token.isCancelled()) || !policy.shouldRetry(attempt, e)) {
                    done = true;
                    throw new RetryExhaustedException(attempt, e);
                }
                long delay = policy.backoffMillis(attempt);
                log.debug("attempt {} failed ({}), retrying in {}ms", attempt, e.toString(), delay);
                try {
                    CancellationToken.sleep(token, delay);
                } catch (OperationAbortedException aborted) {
                    done = true;
                    throw new RetryExhaustedException(attempt, e);
                }
            }

            private void closeCurrent() {
                Cursor<T> c = current;
                current = null;
                if (c != null) c.close();
            }

            @Override
            public void close() {
                done = true;
                closeCurrent();
            }
        };
    }
}
