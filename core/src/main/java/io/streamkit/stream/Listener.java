package io.streamkit.stream;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A subscriber to an {@link EventStream}: either a plain {@link Callback} or an {@link Observer} with separate
 * value, error and completion paths.
 * <p>
 * Value functions may return a {@link CompletionStage}; the stream never awaits it, but routes its failure to
 * the observer's error handler or the stream's reporter. Synchronous listeners return {@code null}.
 */
public sealed interface Listener<T> permits Listener.Callback, Listener.Observer {

    /**
     * @param onNext     receives each value
     * @param onComplete optional completion signal, distinct from any value
     */
    record Callback<T>(Function<? super T, ? extends CompletionStage<?>> onNext, Runnable onComplete) implements Listener<T> {
        public Callback {
            Objects.requireNonNull(onNext, "onNext");
        }
    }

    record Observer<T>(Function<? super T, ? extends CompletionStage<?>> onNext,
                       Consumer<? super Throwable> onError,
                       Runnable onComplete) implements Listener<T> {
        public Observer {
            Objects.requireNonNull(onNext, "onNext");
        }
    }

    static <T> Listener<T> of(Consumer<? super T> onNext) {
        return new Callback<>(sync(onNext), null);
    }

    static <T> Listener<T> of(Consumer<? super T> onNext, Runnable onComplete) {
        return new Callback<>(sync(onNext), onComplete);
    }

    static <T> Listener<T> async(Function<? super T, ? extends CompletionStage<?>> onNext) {
        return new Callback<>(onNext, null);
    }

    static <T> Listener<T> observer(Consumer<? super T> onNext, Consumer<? super Throwable> onError, Runnable onComplete) {
        return new Observer<>(sync(onNext), onError, onComplete);
    }

    static <T> Listener<T> asyncObserver(Function<? super T, ? extends CompletionStage<?>> onNext,
                                         Consumer<? super Throwable> onError,
                                         Runnable onComplete) {
        return new Observer<>(onNext, onError, onComplete);
    }

    private static <T> Function<T, CompletionStage<?>> sync(Consumer<? super T> onNext) {
        Objects.requireNonNull(onNext, "onNext");
        return v -> {
            onNext.accept(v);
            return null;
        };
    }
}
