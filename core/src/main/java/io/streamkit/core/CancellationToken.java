package io.streamkit.core;

import io.streamkit.error.OperationAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared signal that operators, queues and sources observe to abort cooperatively.
 * <p>
 * {@link #cancel()} is idempotent and runs the registered callbacks synchronously, in registration order,
 * on the cancelling thread. A callback registered after cancellation runs immediately.
 */
public final class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final Set<Runnable> callbacks = new LinkedHashSet<>();
    private boolean cancelled;

    public boolean isCancelled() {
        synchronized (this) { return cancelled; }
    }

    public void throwIfCancelled() {
        if (isCancelled()) throw new OperationAbortedException();
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) return;
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable r : toRun) {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.warn("cancellation callback failed", e);
            }
        }
    }

    /**
     * Registers {@code callback} to run on cancellation. Closing the returned registration removes it.
     */
    public Registration onCancel(Runnable callback) {
        Runnable wrapper = callback::run;
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(wrapper);
                return () -> { synchronized (CancellationToken.this) { callbacks.remove(wrapper); } };
            }
        }
        callback.run();
        return () -> {};
    }

    /**
     * Sleeps for {@code millis} unless the token fires first.
     *
     * @throws OperationAbortedException when cancelled or interrupted during the wait
     */
    public void sleep(long millis) {
        if (millis <= 0) { throwIfCancelled(); return; }
        Object monitor = new Object();
        try (Registration ignored = onCancel(() -> { synchronized (monitor) { monitor.notifyAll(); } })) {
            long deadline = System.nanoTime() + millis * 1_000_000L;
            synchronized (monitor) {
                while (!isCancelled()) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) return;
                    monitor.wait(remaining / 1_000_000L, (int) (remaining % 1_000_000L));
                }
            }
        } catch (InterruptedException e) {
            throw OperationAbortedException.interrupted(e);
        }
        throw new OperationAbortedException();
    }

    /** Null-tolerant variant of {@link #sleep(long)}; interruption still surfaces as an abort. */
    public static void sleep(CancellationToken token, long millis) {
        if (token != null) { token.sleep(millis); return; }
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            throw OperationAbortedException.interrupted(e);
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
