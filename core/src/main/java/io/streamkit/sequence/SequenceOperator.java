package io.streamkit.sequence;

/** Pull-mode operator. State belongs to each opened run, never to the operator. */
@FunctionalInterface
public interface SequenceOperator<T, R> {
    Sequence<R> apply(Sequence<T> source);

    default <V> SequenceOperator<T, V> andThen(SequenceOperator<R, V> next) {
        return source -> next.apply(apply(source));
    }
}
