package io.streamkit.workers;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/** Bookkeeping for one worker thread. Everything but {@link #mailbox} is guarded by the pool lock. */
final class WorkerRecord<P, R> {
    final String id;
    final BlockingQueue<Task<P, R>> mailbox = new LinkedBlockingQueue<>();
    Thread thread;
    WorkerState state = WorkerState.IDLE;
    long lastUsedAt;
    Task<P, R> currentTask;

    WorkerRecord(String id, long createdAt) {
        this.id = id;
        this.lastUsedAt = createdAt;
    }
}
