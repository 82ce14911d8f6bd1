package io.streamkit.sequence;

/** What a pump reports about input {@code source}: a value, its end, or its failure. */
record Signal<T>(int source, T value, boolean end, RuntimeException error) {
    static <T> Signal<T> value(int source, T value) { return new Signal<>(source, value, false, null); }

    static <T> Signal<T> end(int source) { return new Signal<>(source, null, true, null); }

    static <T> Signal<T> failure(int source, RuntimeException error) { return new Signal<>(source, null, false, error); }
}
