package io.streamkit.stream;

import java.util.function.Consumer;

/**
 * Anything that can push values to a listener and later forget it, e.g. a transport connector's message
 * callback.
 */
@FunctionalInterface
public interface EventSource<T> {
    /** Registers {@code listener}; closing the returned handle deregisters it. */
    AutoCloseable addListener(Consumer<? super T> listener);
}
