package io.streamkit.sequence;

import io.streamkit.core.Schedulers;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Operators over several sequences. Apart from {@link #concat}, every input is drained on its own pump thread
 * as soon as the combined cursor opens.
 */
public final class Combinators {
    private Combinators() {}

    @SafeVarargs
    public static <T> Sequence<T> merge(Sequence<? extends T>... sources) {
        return merge(List.of(sources));
    }

    /**
     * Values of all inputs in arrival order; ends once every input ended. The first input failure ends the
     * merged run with that failure.
     */
    public static <T> Sequence<T> merge(List<? extends Sequence<? extends T>> sources) {
        List<? extends Sequence<? extends T>> inputs = List.copyOf(sources);
        return () -> new PumpedCursor<T, T>(inputs, null, Schedulers.pumps()) {
            private int remaining = inputs.size();

            @Override
            public Optional<T> next() {
                while (remaining > 0) {
                    Signal<T> s = take();
                    if (s == null) return Optional.empty();
                    if (s.error() != null) {
                        remaining = 0;
                        close();
                        throw s.error();
                    }
                    if (s.end()) {
                        remaining--;
                        continue;
                    }
                    return Optional.of(s.value());
                }
                close();
                return Optional.empty();
            }
        };
    }

    @SafeVarargs
    public static <T> Sequence<List<T>> zip(Sequence<? extends T>... sources) {
        return zip(List.of(sources));
    }

    /**
     * One list per index once every input produced its value for that index. Ends as soon as any input ended
     * and has nothing left to pair.
     */
    public static <T> Sequence<List<T>> zip(List<? extends Sequence<? extends T>> sources) {
        List<? extends Sequence<? extends T>> inputs = List.copyOf(sources);
        return () -> {
            if (inputs.isEmpty()) return Cursor.fromIterator(List.<List<T>>of().iterator());
            return new PumpedCursor<T, List<T>>(inputs, null, Schedulers.pumps()) {
                private final List<ArrayDeque<T>> pending = new ArrayList<>();
                private final boolean[] ended = new boolean[inputs.size()];
                private boolean done;

                {
                    for (int i = 0; i < inputs.size(); i++) pending.add(new ArrayDeque<>());
                }

                @Override
                public Optional<List<T>> next() {
                    while (!done) {
                        if (pending.stream().noneMatch(ArrayDeque::isEmpty)) {
                            List<T> tuple = new ArrayList<>(pending.size());
                            for (ArrayDeque<T> q : pending) tuple.add(q.pollFirst());
                            return Optional.of(List.copyOf(tuple));
                        }
                        for (int i = 0; i < ended.length; i++) {
                            if (ended[i] && pending.get(i).isEmpty()) {
                                finish();
                                return Optional.empty();
                            }
                        }
                        Signal<T> s = take();
                        if (s == null) return Optional.empty();
                        if (s.error() != null) {
                            finish();
                            throw s.error();
                        }
                        if (s.end()) ended[s.source()] = true;
                        else pending.get(s.source()).addLast(s.value());
                    }
                    return Optional.empty();
                }

                private void finish() {
                    done = true;
                    close();
                }
            };
        };
    }

    /** Pairs two sequences of different types. */
    @SuppressWarnings("unchecked")
    public static <A, B, R> Sequence<R> zip(Sequence<A> first, Sequence<B> second, BiFunction<? super A, ? super B, ? extends R> combiner) {
        Sequence<List<Object>> pairs = zip(List.<Sequence<?>>of(first, second));
        return pairs.pipe(Operators.<List<Object>, R>map(pair -> combiner.apply((A) pair.get(0), (B) pair.get(1))));
    }

    @SafeVarargs
    public static <T> Sequence<T> race(Sequence<? extends T>... sources) {
        return race(List.of(sources));
    }

    /**
     * The whole run of whichever input produces a value first; the others are stopped at that moment. Inputs
     * that end empty never win; a failure before any value fails the race.
     */
    public static <T> Sequence<T> race(List<? extends Sequence<? extends T>> sources) {
        List<? extends Sequence<? extends T>> inputs = List.copyOf(sources);
        if (inputs.isEmpty()) return Sequences.empty();
        return () -> new PumpedCursor<T, T>(inputs, null, Schedulers.pumps()) {
            private int winner = -1;
            private int endedEmpty;
            private boolean done;

            @Override
            public Optional<T> next() {
                while (!done) {
                    Signal<T> s = take();
                    if (s == null) return Optional.empty();
                    if (winner >= 0 && s.source() != winner) continue;
                    if (s.error() != null) {
                        finish();
                        throw s.error();
                    }
                    if (s.end()) {
                        if (winner >= 0 || ++endedEmpty == inputs()) finish();
                        continue;
                    }
                    if (winner < 0) {
                        winner = s.source();
                        for (int i = 0; i < inputs(); i++) {
                            if (i != winner) stop(i);
                        }
                    }
                    return Optional.of(s.value());
                }
                return Optional.empty();
            }

            private void finish() {
                done = true;
                close();
            }
        };
    }

    @SafeVarargs
    public static <T> Sequence<T> concat(Sequence<? extends T>... sources) {
        return concat(List.of(sources));
    }

    /** Drains each input completely before opening the next, in order. */
    public static <T> Sequence<T> concat(List<? extends Sequence<? extends T>> sources) {
        List<? extends Sequence<? extends T>> inputs = List.copyOf(sources);
        return () -> new Cursor<T>() {
            private int index;
            private Cursor<? extends T> current;

            @Override
            public Optional<T> next() {
                while (index < inputs.size()) {
                    if (current == null) current = inputs.get(index).open();
                    Optional<? extends T> v = current.next();
                    if (v.isPresent()) return Optional.of(v.get());
                    current.close();
                    current = null;
                    index++;
                }
                return Optional.empty();
            }

            @Override
            public void close() {
                index = inputs.size();
                if (current != null) {
                    current.close();
                    current = null;
                }
            }
        };
    }
}
