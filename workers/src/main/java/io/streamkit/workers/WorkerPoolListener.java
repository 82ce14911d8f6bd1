package io.streamkit.workers;

/**
 * Worker lifecycle hooks. Called with the pool lock held, so implementations must be quick and must not
 * wait on other pool threads.
 */
public interface WorkerPoolListener {
    WorkerPoolListener NOOP = new WorkerPoolListener() {};

    default void workerCreated(String workerId) {}

    /** {@code exitCode} is 0 for a reaped or shut down worker and 1 for one that died. */
    default void workerTerminated(String workerId, int exitCode) {}
}
