package io.streamkit.stream;

/** Push-mode operator: derives a new stream from a source stream. */
@FunctionalInterface
public interface StreamOperator<T, R> {
    EventStream<R> apply(EventStream<T> source);

    default <V> StreamOperator<T, V> andThen(StreamOperator<R, V> next) {
        return source -> next.apply(apply(source));
    }
}
