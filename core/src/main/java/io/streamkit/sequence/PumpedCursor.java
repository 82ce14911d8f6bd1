package io.streamkit.sequence;

import io.streamkit.core.CancellationToken;
import io.streamkit.queue.BackpressureQueue;
import io.streamkit.queue.Pull;
import io.streamkit.queue.QueueConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Base for cursors that consume their inputs through background pumps. Every input reports into one signal
 * queue, so the consuming thread sees values, ends and failures in arrival order and can wait with a deadline.
 */
abstract class PumpedCursor<T, R> implements Cursor<R> {
    private final BackpressureQueue<Signal<T>> signals;
    private final List<Pump> pumps = new ArrayList<>();
    private boolean closed;

    PumpedCursor(List<? extends Sequence<? extends T>> sources, CancellationToken token, ExecutorService executor) {
        this.signals = new BackpressureQueue<>(QueueConfig.UNBOUNDED.withToken(token));
        for (int i = 0; i < sources.size(); i++) {
            pumps.add(Pump.start(i, sources.get(i), signals, executor));
        }
    }

    /** Blocks for the next signal; {@code null} once this cursor was closed. */
    protected Signal<T> take() {
        Optional<Signal<T>> s = signals.next();
        return s.orElse(null);
    }

    /**
     * Waits at most {@code nanos} for the next signal.
     *
     * @return the signal, {@link Pull#timeout()} or {@link Pull#end()} once closed
     */
    protected Pull<Signal<T>> poll(long nanos) {
        return signals.poll(Math.max(0, nanos), TimeUnit.NANOSECONDS);
    }

    protected int inputs() { return pumps.size(); }

    /** Stops input {@code index}; signals it already sent stay queued. */
    protected void stop(int index) {
        pumps.get(index).close();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        pumps.forEach(Pump::close);
        signals.close();
    }
}
