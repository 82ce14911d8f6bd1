package io.streamkit.sequence;

import java.util.Iterator;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * One run of a {@link Sequence}. Not thread-safe; a cursor belongs to the thread that consumes it.
 */
public interface Cursor<T> extends AutoCloseable {

    /**
     * Blocks until the next value is available.
     *
     * @return the value, or empty once the run is exhausted
     */
    Optional<T> next();

    /** Releases timers, pumps and upstream cursors. Idempotent. */
    @Override
    default void close() {}

    static <T> Cursor<T> of(Supplier<Optional<T>> next, Runnable onClose) {
        return new Cursor<>() {
            private boolean closed;

            @Override
            public Optional<T> next() {
                return closed ? Optional.empty() : next.get();
            }

            @Override
            public void close() {
                if (closed) return;
                closed = true;
                onClose.run();
            }
        };
    }

    static <T> Cursor<T> fromIterator(Iterator<? extends T> it) {
        return of(() -> it.hasNext() ? Optional.of(it.next()) : Optional.empty(), () -> {});
    }
}
