package io.streamkit.sequence;

import io.streamkit.queue.BackpressureQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains one run of a sequence on a background thread. Closing the pump interrupts the thread and closes
 * the run's cursor; nothing is reported after that.
 */
final class Pump implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Pump.class);

    interface Sink<T> {
        /** @return {@code false} to stop pumping */
        boolean value(T value);

        void end();

        void fail(RuntimeException error);
    }

    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Future<?> task;

    private Pump() {}

    static <T> Pump start(Sequence<T> source, Sink<? super T> sink, ExecutorService executor) {
        Pump pump = new Pump();
        pump.task = executor.submit(() -> pump.run(source, sink));
        return pump;
    }

    /** Pumps {@code source} as input {@code index} of a signal queue. */
    static <T> Pump start(int index, Sequence<? extends T> source, BackpressureQueue<Signal<T>> signals, ExecutorService executor) {
        return start(source, new Sink<T>() {
            @Override
            public boolean value(T value) { return signals.enqueue(Signal.value(index, value)); }

            @Override
            public void end() { signals.enqueue(Signal.end(index)); }

            @Override
            public void fail(RuntimeException error) { signals.enqueue(Signal.failure(index, error)); }
        }, executor);
    }

    private <T> void run(Sequence<T> source, Sink<? super T> sink) {
        try (Cursor<T> cursor = source.open()) {
            while (!closed.get()) {
                Optional<T> v = cursor.next();
                if (closed.get()) return;
                if (v.isEmpty()) {
                    sink.end();
                    return;
                }
                if (!sink.value(v.get())) return;
            }
        } catch (RuntimeException e) {
            if (closed.get()) {
                log.debug("pump stopped: {}", e.toString());
                return;
            }
            sink.fail(e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        Future<?> f = task;
        if (f != null) f.cancel(true);
    }
}
