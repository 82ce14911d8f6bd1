package io.streamkit.queue;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import io.streamkit.core.CancellationToken;
import io.streamkit.error.OperationAbortedException;
import io.streamkit.error.QueueOverflowException;
import io.streamkit.error.UpstreamFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bridges a push producer into a bounded pull consumer.
 * <p>
 * Producers call {@link #enqueue(Object)}; consumers call {@link #next()}, {@link #nextAsync()} or
 * {@link #poll(long, TimeUnit)}. A waiting consumer is handed the item directly, so a pending consumer and a
 * non-empty buffer never coexist. Once {@linkplain #end() ended} the queue stays closed and further enqueues
 * are ignored. A failure passed to {@link #end(Throwable)} takes precedence over buffered items.
 */
public class BackpressureQueue<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackpressureQueue.class);

    private final Object lock = new Object();
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    private final ArrayDeque<CompletableFuture<Pull<T>>> waiting = new ArrayDeque<>();
    private final List<AutoCloseable> upstream = new ArrayList<>();
    private final int limit;
    private final OverflowPolicy policy;
    private final LongAdder dropped = new LongAdder();

    private boolean ended;
    private RuntimeException failure;
    private CancellationToken.Registration cancelRegistration;

    public BackpressureQueue() {
        this(QueueConfig.UNBOUNDED);
    }

    public BackpressureQueue(QueueConfig config) {
        Objects.requireNonNull(config, "config");
        this.limit = config.limit();
        this.policy = config.overflowPolicy();
        if (config.token() != null) {
            CancellationToken.Registration registration = config.token().onCancel(this::abort);
            synchronized (lock) {
                if (ended) registration.close();
                else cancelRegistration = registration;
            }
        }
    }

    /**
     * Offers an item.
     *
     * @return {@code true} if the item was handed off or buffered, {@code false} if it was dropped or the queue
     * is closed
     * @throws QueueOverflowException when full under {@link OverflowPolicy#THROW}; the queue is closed as well
     */
    public boolean enqueue(T item) {
        Objects.requireNonNull(item, "item");
        CompletableFuture<Pull<T>> consumer;
        QueueOverflowException overflow = null;
        synchronized (lock) {
            if (ended) return false;
            consumer = waiting.pollFirst();
            if (consumer == null) {
                if (limit > 0 && buffer.size() >= limit) {
                    switch (policy) {
                        case DROP_OLD -> { buffer.pollFirst(); dropped.increment(); }
                        case DROP_NEW -> { dropped.increment(); return false; }
                        case THROW -> overflow = new QueueOverflowException(limit);
                    }
                }
                if (overflow == null) {
                    buffer.addLast(item);
                    return true;
                }
            }
        }
        if (overflow != null) {
            log.debug("queue overflow at limit {}, closing", limit);
            end(overflow);
            throw overflow;
        }
        consumer.complete(Pull.value(item));
        return true;
    }

    /**
     * Blocks until an item is available or the queue ends.
     *
     * @return the next item, or empty once the queue has ended and drained
     */
    public Optional<T> next() {
        CompletableFuture<Pull<T>> f = nextAsync();
        try {
            Pull<T> pull = f.get();
            return pull.isValue() ? Optional.of(pull.value()) : Optional.empty();
        } catch (InterruptedException e) {
            abandon(f);
            throw OperationAbortedException.interrupted(e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * Returns the head immediately if buffered, otherwise registers a continuation resolved by the next
     * enqueue or by {@link #end()}.
     */
    public CompletableFuture<Pull<T>> nextAsync() {
        synchronized (lock) {
            T head = buffer.pollFirst();
            if (head != null) return CompletableFuture.completedFuture(Pull.value(head));
            if (ended) {
                return failure != null ? CompletableFuture.failedFuture(failure) : CompletableFuture.completedFuture(Pull.end());
            }
            CompletableFuture<Pull<T>> f = new CompletableFuture<>();
            waiting.addLast(f);
            return f;
        }
    }

    /**
     * Waits at most {@code timeout} for the next item.
     *
     * @return a value, {@link Pull#end()} or {@link Pull#timeout()}
     */
    public Pull<T> poll(long timeout, TimeUnit unit) {
        if (timeout <= 0) {
            synchronized (lock) {
                T head = buffer.pollFirst();
                if (head != null) return Pull.value(head);
                if (!ended) return Pull.timeout();
                if (failure != null) throw failure;
                return Pull.end();
            }
        }
        CompletableFuture<Pull<T>> f = nextAsync();
        try {
            return f.get(timeout, unit);
        } catch (TimeoutException e) {
            synchronized (lock) {
                if (waiting.remove(f)) return Pull.timeout();
            }
            // a producer completed it between the timeout and the removal
            return join(f);
        } catch (InterruptedException e) {
            abandon(f);
            throw OperationAbortedException.interrupted(e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /** Ends the queue normally. Idempotent. */
    public void end() {
        end(null);
    }

    /**
     * Ends the queue; pending consumers complete as done, or fail with {@code error} when given. Upstream
     * registrations are released before any consumer is resumed.
     */
    public void end(Throwable error) {
        List<CompletableFuture<Pull<T>>> pending;
        List<AutoCloseable> registrations;
        CancellationToken.Registration registration;
        synchronized (lock) {
            if (ended) return;
            ended = true;
            if (error != null) {
                failure = error instanceof RuntimeException re ? re : new UpstreamFailureException(error);
                buffer.clear();
            }
            pending = new ArrayList<>(waiting);
            waiting.clear();
            registrations = new ArrayList<>(upstream);
            upstream.clear();
            registration = cancelRegistration;
            cancelRegistration = null;
        }
        registrations.forEach(BackpressureQueue::closeQuietly);
        if (registration != null) registration.close();
        for (CompletableFuture<Pull<T>> f : pending) {
            if (failure != null) f.completeExceptionally(failure);
            else f.complete(Pull.end());
        }
    }

    /**
     * Ties an upstream registration (an event listener, a subscription) to this queue's lifetime. It is closed
     * when the queue ends or is cancelled; if the queue already ended it is closed immediately.
     */
    public void bindUpstream(AutoCloseable registration) {
        Objects.requireNonNull(registration, "registration");
        synchronized (lock) {
            if (!ended) {
                upstream.add(registration);
                return;
            }
        }
        closeQuietly(registration);
    }

    private void abort() {
        end(new OperationAbortedException());
    }

    /** Consumer-side early exit, equivalent to {@link #end()}. */
    @Override
    public void close() {
        end();
    }

    public int size() {
        synchronized (lock) { return buffer.size(); }
    }

    public boolean isEnded() {
        synchronized (lock) { return ended; }
    }

    public int limit() { return limit; }

    public long droppedCount() { return dropped.sum(); }

    /** Snapshot of buffered items, oldest first. */
    public List<T> snapshot() {
        synchronized (lock) { return List.copyOf(buffer); }
    }

    public void registerMetrics(MetricRegistry registry, String name) {
        registry.register(MetricRegistry.name("queue", name, "depth"), (Gauge<Integer>) this::size);
        registry.register(MetricRegistry.name("queue", name, "dropped"), (Gauge<Long>) this::droppedCount);
    }

    private void abandon(CompletableFuture<Pull<T>> f) {
        synchronized (lock) {
            if (waiting.remove(f)) return;
            // handed an item while we were being interrupted: keep it for the next consumer
            if (!f.isDone() || f.isCompletedExceptionally() || failure != null) return;
            Pull<T> pull = f.join();
            if (pull.isValue()) buffer.addFirst(pull.value());
        }
    }

    private Pull<T> join(CompletableFuture<Pull<T>> f) {
        try {
            return f.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static RuntimeException unwrap(Throwable t) {
        if (t instanceof RuntimeException re) return re;
        if (t instanceof Error err) throw err;
        return new UpstreamFailureException(t);
    }

    private static void closeQuietly(AutoCloseable c) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("failed to release upstream registration", e);
        }
    }
}
