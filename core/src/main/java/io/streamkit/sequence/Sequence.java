package io.streamkit.sequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A lazy, re-openable description of values. Nothing runs until {@link #open()}; every call starts an
 * independent run. Elements are never {@code null}.
 */
@FunctionalInterface
public interface Sequence<T> {

    Cursor<T> open();

    default <R> Sequence<R> pipe(SequenceOperator<T, R> operator) {
        return operator.apply(this);
    }

    /** Drains a fresh run into a list. */
    default List<T> toList() {
        List<T> out = new ArrayList<>();
        forEach(out::add);
        return out;
    }

    default Optional<T> first() {
        try (Cursor<T> cursor = open()) {
            return cursor.next();
        }
    }

    default void forEach(Consumer<? super T> action) {
        try (Cursor<T> cursor = open()) {
            for (Optional<T> v = cursor.next(); v.isPresent(); v = cursor.next()) {
                action.accept(v.get());
            }
        }
    }
}
