package io.streamkit.workers;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.streamkit.core.Schedulers;
import io.streamkit.error.PoolTerminatingException;
import io.streamkit.error.QueueFullException;
import io.streamkit.error.WorkerFailureException;
import io.streamkit.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dynamically sized pool of dedicated worker threads, each running one task at a time.
 * <p>
 * A submission goes to an idle worker, else to a newly created one while below {@code maxWorkers}, else to a
 * bounded FIFO queue. Queued tasks are handed out by a single coordinator thread in batches, which also runs
 * the periodic idle sweep. All pool bookkeeping is guarded by one lock.
 */
public class WorkerPool<P, R> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    static final int DRAIN_BATCH = 10;

    private final WorkerHandler<P, R> handler;
    private final WorkerPoolConfig config;
    private final WorkerPoolListener listener;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, WorkerRecord<P, R>> workers = new LinkedHashMap<>();
    private final Deque<Task<P, R>> queue = new ArrayDeque<>();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private int workerCounter;
    private boolean terminating;

    private final ScheduledExecutorService coordinator;
    private final ScheduledFuture<?> reaper;
    private final AtomicBoolean drainScheduled = new AtomicBoolean();

    private final Meter submittedMeter;
    private final Meter completedMeter;
    private final Meter failedMeter;
    private final Meter rejectedMeter;
    private final Timer taskTimer;
    private final Timer queueWaitTimer;

    public WorkerPool(WorkerHandler<P, R> handler, WorkerPoolConfig config) {
        this(handler, config, Metrics.detached("workers"), WorkerPoolListener.NOOP, Clock.systemUTC());
    }

    public WorkerPool(WorkerHandler<P, R> handler, WorkerPoolConfig config, Metrics metrics,
                      WorkerPoolListener listener, Clock clock) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.config = Objects.requireNonNull(config, "config");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(metrics, "metrics");

        this.submittedMeter = metrics.meter("submitted");
        this.completedMeter = metrics.meter("completed");
        this.failedMeter = metrics.meter("failed");
        this.rejectedMeter = metrics.meter("rejected");
        this.taskTimer = metrics.timer("task.time");
        this.queueWaitTimer = metrics.timer("queue.wait");
        metrics.gauge("workers", () -> stats().total());
        metrics.gauge("busy", () -> stats().busy());
        metrics.gauge("queued", () -> stats().queued());

        String prefix = config.workerOptions().namePrefix();
        this.coordinator = Executors.newSingleThreadScheduledExecutor(Schedulers.daemon(prefix + "-coordinator"));
        synchronized (lock) {
            for (int i = 0; i < config.minWorkers(); i++) createWorker();
        }
        this.reaper = coordinator.scheduleWithFixedDelay(this::reapIdleWorkers,
                config.reapIntervalMs(), config.reapIntervalMs(), TimeUnit.MILLISECONDS);
    }

    public static <P, R> WorkerPoolBuilder<P, R> builder(WorkerHandler<P, R> handler) {
        return new WorkerPoolBuilder<>(handler);
    }

    public CompletableFuture<R> execute(P payload) {
        return execute(payload, List.of());
    }

    /**
     * Runs {@code payload} on a worker. Fails immediately with {@link PoolTerminatingException} once
     * {@link #terminate} was called and with {@link QueueFullException} when no worker is free, none can be
     * added and the queue is full. A handler exception fails the result with {@link WorkerFailureException}.
     */
    public CompletableFuture<R> execute(P payload, List<?> transferables) {
        Objects.requireNonNull(transferables, "transferables");
        submittedMeter.mark();
        Task<P, R> task = new Task<>(payload, List.copyOf(transferables), clock.millis());
        synchronized (lock) {
            if (terminating) {
                rejectedMeter.mark();
                return CompletableFuture.failedFuture(new PoolTerminatingException());
            }
            WorkerRecord<P, R> worker = findIdle();
            if (worker == null && workers.size() < config.maxWorkers()) worker = createWorker();
            if (worker != null) {
                assign(worker, task);
            } else if (queue.size() < config.maxQueueSize()) {
                queue.addLast(task);
            } else {
                rejectedMeter.mark();
                return CompletableFuture.failedFuture(new QueueFullException(config.maxQueueSize()));
            }
        }
        return task.future;
    }

    public PoolStats stats() {
        synchronized (lock) {
            int idle = 0, busy = 0, stopping = 0;
            for (WorkerRecord<P, R> w : workers.values()) {
                switch (w.state) {
                    case IDLE -> idle++;
                    case BUSY -> busy++;
                    case TERMINATING -> stopping++;
                    default -> { }
                }
            }
            return new PoolStats(workers.size(), idle, busy, stopping, queue.size());
        }
    }

    public WorkerPoolConfig config() { return config; }

    public boolean isTerminating() {
        synchronized (lock) {
            return terminating;
        }
    }

    /**
     * Stops accepting tasks and fails every queued one with {@link PoolTerminatingException}. A graceful
     * termination lets running tasks finish and completes once every worker exited; a forced one fails the
     * running tasks too, interrupts the workers and completes at once. Repeated calls return the same future.
     */
    public CompletableFuture<Void> terminate(boolean force) {
        List<Task<P, R>> dropped;
        List<Task<P, R>> aborted = new ArrayList<>();
        synchronized (lock) {
            if (terminating) return terminated;
            terminating = true;
            dropped = new ArrayList<>(queue);
            queue.clear();
            for (WorkerRecord<P, R> w : workers.values()) {
                if (w.state == WorkerState.TERMINATED) continue;
                w.state = WorkerState.TERMINATING;
                if (force) {
                    if (w.currentTask != null) aborted.add(w.currentTask);
                    w.currentTask = null;
                    w.thread.interrupt();
                } else {
                    w.mailbox.offer(Task.stop());
                }
            }
            if (force || workers.isEmpty()) terminated.complete(null);
        }
        log.debug("Terminating pool force={} queued={} running={}", force, dropped.size(), aborted.size());
        reaper.cancel(false);
        coordinator.shutdown();
        dropped.forEach(t -> t.future.completeExceptionally(new PoolTerminatingException()));
        aborted.forEach(t -> t.future.completeExceptionally(new PoolTerminatingException("Worker is terminating")));
        failedMeter.mark(aborted.size());
        return terminated;
    }

    @Override
    public void close() {
        terminate(false);
    }

    // --- worker threads ---

    private WorkerRecord<P, R> createWorker() {
        String id = "worker-" + (++workerCounter);
        WorkerRecord<P, R> w = new WorkerRecord<>(id, clock.millis());
        WorkerOptions options = config.workerOptions();
        Thread t = new Thread(() -> runWorker(w), options.namePrefix() + "-" + workerCounter);
        t.setDaemon(options.daemon());
        w.thread = t;
        workers.put(id, w);
        t.start();
        log.debug("Created {} ({} workers)", id, workers.size());
        listener.workerCreated(id);
        return w;
    }

    private void runWorker(WorkerRecord<P, R> w) {
        Throwable fatal = null;
        try {
            while (true) {
                Task<P, R> task = w.mailbox.take();
                if (task.isStop() || !runTask(w, task)) break;
            }
        } catch (InterruptedException e) {
            if (!isStopping(w)) fatal = e;
        } catch (Throwable t) {
            fatal = t;
        } finally {
            onWorkerExit(w, fatal);
        }
    }

    /** Returns whether the worker should keep taking tasks. */
    private boolean runTask(WorkerRecord<P, R> w, Task<P, R> task) {
        R result = null;
        Exception failure = null;
        try {
            result = handler.handle(task.payload, task.transferables);
        } catch (Exception e) {
            failure = e;
        }
        boolean keepRunning;
        boolean current;
        synchronized (lock) {
            current = w.currentTask == task;
            if (current) {
                w.currentTask = null;
                w.lastUsedAt = clock.millis();
                if (w.state == WorkerState.BUSY) w.state = WorkerState.IDLE;
            }
            keepRunning = w.state == WorkerState.IDLE;
        }
        if (current) {
            taskTimer.update(clock.millis() - task.startedAt, TimeUnit.MILLISECONDS);
            if (failure == null) {
                completedMeter.mark();
                task.future.complete(result);
            } else {
                failedMeter.mark();
                task.future.completeExceptionally(
                        new WorkerFailureException(w.id, "Task failed on " + w.id + ": " + failure.getMessage(), failure));
            }
        }
        if (keepRunning) scheduleDrain();
        return keepRunning;
    }

    private void onWorkerExit(WorkerRecord<P, R> w, Throwable fatal) {
        int exitCode = fatal == null ? 0 : 1;
        Task<P, R> orphan;
        boolean allGone;
        synchronized (lock) {
            orphan = w.currentTask;
            w.currentTask = null;
            w.state = WorkerState.TERMINATED;
            workers.remove(w.id);
            listener.workerTerminated(w.id, exitCode);
            if (!terminating && workers.size() < config.maxWorkers()
                    && (fatal != null || liveWorkers() < config.minWorkers())) {
                createWorker();
            }
            allGone = terminating && workers.isEmpty();
        }
        if (fatal != null) {
            log.warn("Worker {} died: {}", w.id, fatal.toString(), fatal);
        } else {
            log.debug("Worker {} exited", w.id);
        }
        if (orphan != null) {
            failedMeter.mark();
            orphan.future.completeExceptionally(new WorkerFailureException(w.id, "Worker " + w.id + " died", fatal));
        }
        if (allGone) terminated.complete(null);
        scheduleDrain();
    }

    private boolean isStopping(WorkerRecord<P, R> w) {
        synchronized (lock) {
            return terminating || w.state == WorkerState.TERMINATING;
        }
    }

    // --- coordinator ---

    private void scheduleDrain() {
        if (!drainScheduled.compareAndSet(false, true)) return;
        try {
            coordinator.execute(this::drainQueue);
        } catch (RejectedExecutionException e) {
            // the coordinator only stops on terminate, which already emptied the queue
            drainScheduled.set(false);
            log.debug("Drain skipped, pool terminated");
        }
    }

    void drainQueue() {
        drainScheduled.set(false);
        boolean more;
        synchronized (lock) {
            int processed = 0;
            while (!queue.isEmpty() && processed < DRAIN_BATCH) {
                WorkerRecord<P, R> w = findIdle();
                if (w == null) {
                    if (terminating || workers.size() >= config.maxWorkers()) break;
                    w = createWorker();
                }
                assign(w, queue.pollFirst());
                processed++;
            }
            more = !queue.isEmpty() && processed == DRAIN_BATCH;
        }
        if (more) scheduleDrain();
    }

    void reapIdleWorkers() {
        synchronized (lock) {
            if (terminating) return;
            long now = clock.millis();
            int excess = liveWorkers() - config.minWorkers();
            for (WorkerRecord<P, R> w : workers.values()) {
                if (excess <= 0) break;
                if (w.state == WorkerState.IDLE && now - w.lastUsedAt > config.idleTimeoutMs()) {
                    w.state = WorkerState.TERMINATING;
                    w.mailbox.offer(Task.stop());
                    excess--;
                    log.debug("Reaping idle {}", w.id);
                }
            }
        }
    }

    // --- helpers, lock held ---

    private WorkerRecord<P, R> findIdle() {
        for (WorkerRecord<P, R> w : workers.values()) {
            if (w.state == WorkerState.IDLE) return w;
        }
        return null;
    }

    private int liveWorkers() {
        int n = 0;
        for (WorkerRecord<P, R> w : workers.values()) {
            if (w.state == WorkerState.IDLE || w.state == WorkerState.BUSY) n++;
        }
        return n;
    }

    private void assign(WorkerRecord<P, R> w, Task<P, R> task) {
        w.state = WorkerState.BUSY;
        w.currentTask = task;
        task.startedAt = clock.millis();
        queueWaitTimer.update(task.startedAt - task.enqueuedAt, TimeUnit.MILLISECONDS);
        w.mailbox.offer(task);
    }
}
