package io.streamkit.core;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared daemon executors used by the convenience overloads. Every component that needs one also accepts
 * an explicit executor, so callers that care about lifecycle can bring their own.
 */
public final class Schedulers {
    private static final ScheduledExecutorService TIMER = Executors.newSingleThreadScheduledExecutor(daemon("streamkit-timer"));
    private static final ExecutorService PUMPS = Executors.newCachedThreadPool(daemon("streamkit-pump"));

    private Schedulers() {}

    /** Single daemon thread for timers and deferred dispatch. Tasks must not block. */
    public static ScheduledExecutorService timer() { return TIMER; }

    /** Cached daemon threads that drain blocking sequence cursors. */
    public static ExecutorService pumps() { return PUMPS; }

    public static ThreadFactory daemon(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
