package io.streamkit.stream;

import io.streamkit.core.Schedulers;
import io.streamkit.error.FailureReporter;
import io.streamkit.error.LoggingFailureReporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process fan-out of values to listeners, terminated by {@link #complete()}.
 * <p>
 * Emission happens synchronously on the caller's thread and always iterates a snapshot of the listeners, so
 * listeners may (un)subscribe while being notified. A listener that fails is isolated: its own error handler or
 * the {@link FailureReporter} sees the failure, and the remaining listeners still receive the value.
 * <p>
 * A stream built with {@link #connected(Connector)} attaches to its upstream when the first listener arrives and
 * runs the connector's teardown when the listener set becomes empty or the stream completes.
 */
public final class EventStream<T> {
    // one entry per subscribe call; removal is by identity so equal listeners stay independent
    private final List<Entry<T>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final Executor dispatcher;
    private final FailureReporter reporter;
    private final Connector<T> connector;

    private boolean connected;
    private Runnable teardown;

    /**
     * Attaches a stream to its upstream.
     */
    @FunctionalInterface
    public interface Connector<T> {
        /**
         * Starts feeding {@code downstream}.
         *
         * @return teardown to run once nobody listens any more or the stream completes; may be {@code null}
         */
        Runnable connect(EventStream<T> downstream);
    }

    private EventStream(Executor dispatcher, FailureReporter reporter, Connector<T> connector) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.connector = connector;
    }

    public static <T> EventStream<T> create() {
        return new EventStream<>(Schedulers.timer(), LoggingFailureReporter.INSTANCE, null);
    }

    public static <T> EventStream<T> create(Executor dispatcher, FailureReporter reporter) {
        return new EventStream<>(dispatcher, reporter, null);
    }

    public static <T> EventStream<T> connected(Connector<T> connector) {
        return new EventStream<>(Schedulers.timer(), LoggingFailureReporter.INSTANCE, Objects.requireNonNull(connector, "connector"));
    }

    public static <T> EventStream<T> connected(Executor dispatcher, FailureReporter reporter, Connector<T> connector) {
        return new EventStream<>(dispatcher, reporter, Objects.requireNonNull(connector, "connector"));
    }

    public Subscription subscribe(java.util.function.Consumer<? super T> callback) {
        return subscribe(Listener.of(callback));
    }

    /**
     * Adds a listener. On a completed stream an observer's completion is scheduled on the dispatcher (never run
     * inline), a callback receives nothing, and the returned subscription does nothing.
     */
    public Subscription subscribe(Listener<T> listener) {
        Objects.requireNonNull(listener, "listener");
        if (completed.get()) {
            completeLater(listener);
            return Subscription.NOOP;
        }
        Entry<T> entry = new Entry<>(listener);
        listeners.add(entry);
        if (completed.get() && listeners.remove(entry)) {
            // lost the race against complete(); behave as a late subscriber
            completeLater(listener);
            return Subscription.NOOP;
        }
        connectIfNeeded();
        return new Subscription(() -> {
            if (listeners.remove(entry) && listeners.isEmpty()) disconnect();
        });
    }

    public void emit(T value) {
        if (completed.get()) return;
        for (Entry<T> entry : listeners) {
            deliver(entry.listener, value);
        }
    }

    /** Idempotent. Every listener present at this moment gets its completion path exactly once. */
    public void complete() {
        if (!completed.compareAndSet(false, true)) return;
        List<Entry<T>> snapshot = new ArrayList<>(listeners);
        listeners.clear();
        for (Entry<T> entry : snapshot) {
            runCompletion(entry.listener);
        }
        disconnect();
    }

    public <R> EventStream<R> pipe(StreamOperator<T, R> operator) {
        return operator.apply(this);
    }

    public boolean isCompleted() { return completed.get(); }

    public int listenerCount() { return listeners.size(); }

    Executor dispatcher() { return dispatcher; }

    FailureReporter reporter() { return reporter; }

    private static final class Entry<T> {
        final Listener<T> listener;

        Entry(Listener<T> listener) {
            this.listener = listener;
        }
    }

    private void deliver(Listener<T> listener, T value) {
        try {
            CompletionStage<?> result;
            if (listener instanceof Listener.Callback<T> cb) {
                result = cb.onNext().apply(value);
            } else if (listener instanceof Listener.Observer<T> ob) {
                result = ob.onNext().apply(value);
            } else {
                throw new IllegalStateException("unknown listener " + listener);
            }
            if (result != null) {
                result.whenComplete((ignored, ex) -> {
                    if (ex != null) fail(listener, value, ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex);
                });
            }
        } catch (RuntimeException e) {
            fail(listener, value, e);
        }
    }

    private void fail(Listener<T> listener, T value, Throwable error) {
        if (listener instanceof Listener.Observer<T> ob && ob.onError() != null) {
            try {
                ob.onError().accept(error);
            } catch (RuntimeException e) {
                reporter.report("error-handler", value, e);
            }
            return;
        }
        reporter.report("listener", value, error);
    }

    private void runCompletion(Listener<T> listener) {
        Runnable onComplete = listener instanceof Listener.Observer<T> ob ? ob.onComplete()
                : ((Listener.Callback<T>) listener).onComplete();
        if (onComplete == null) return;
        try {
            onComplete.run();
        } catch (RuntimeException e) {
            reporter.report("complete", null, e);
        }
    }

    private void completeLater(Listener<T> listener) {
        if (listener instanceof Listener.Observer<T> ob && ob.onComplete() != null) {
            dispatcher.execute(() -> runCompletion(listener));
        }
    }

    private void connectIfNeeded() {
        if (connector == null) return;
        synchronized (this) {
            if (connected || completed.get()) return;
            connected = true;
        }
        Runnable td = connector.connect(this);
        boolean stale;
        synchronized (this) {
            stale = !connected || completed.get();
            if (!stale) teardown = td;
        }
        // completed or abandoned while connecting
        if (stale && td != null) td.run();
    }

    private void disconnect() {
        Runnable td;
        synchronized (this) {
            if (!connected) return;
            connected = false;
            td = teardown;
            teardown = null;
        }
        if (td != null) td.run();
    }
}
