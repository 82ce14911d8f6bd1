package io.streamkit.queue;

import java.util.NoSuchElementException;

/** Outcome of a timed consumer wait: a value, the end of the queue, or nothing yet. */
public final class Pull<T> {
    public enum Kind { VALUE, END, TIMEOUT }

    private static final Pull<?> END = new Pull<>(Kind.END, null);
    private static final Pull<?> TIMEOUT = new Pull<>(Kind.TIMEOUT, null);

    private final Kind kind;
    private final T value;

    private Pull(Kind kind, T value) {
        this.kind = kind;
        this.value = value;
    }

    public static <T> Pull<T> value(T value) { return new Pull<>(Kind.VALUE, value); }

    @SuppressWarnings("unchecked")
    public static <T> Pull<T> end() { return (Pull<T>) END; }

    @SuppressWarnings("unchecked")
    public static <T> Pull<T> timeout() { return (Pull<T>) TIMEOUT; }

    public Kind kind() { return kind; }
    public boolean isValue() { return kind == Kind.VALUE; }
    public boolean isEnd() { return kind == Kind.END; }
    public boolean isTimeout() { return kind == Kind.TIMEOUT; }

    public T value() {
        if (kind != Kind.VALUE) throw new NoSuchElementException("no value: " + kind);
        return value;
    }

    @Override
    public String toString() {
        return kind == Kind.VALUE ? "Pull{" + value + "}" : "Pull{" + kind + "}";
    }
}
