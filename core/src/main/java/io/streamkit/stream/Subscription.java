package io.streamkit.stream;

import java.util.concurrent.atomic.AtomicBoolean;

/** Handle returned by {@link EventStream#subscribe}. Unsubscribing is idempotent. */
public final class Subscription implements AutoCloseable {
    static final Subscription NOOP = new Subscription(() -> {});

    private final Runnable action;
    private final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(Runnable action) {
        this.action = action;
    }

    public void unsubscribe() {
        if (active.compareAndSet(true, false)) action.run();
    }

    public boolean isActive() { return active.get(); }

    @Override
    public void close() {
        unsubscribe();
    }
}
