package io.streamkit.error;

/**
 * A task failed on a worker, either because the handler threw or because the worker itself died.
 */
public class WorkerFailureException extends StreamkitException {
    private final String workerId;

    public WorkerFailureException(String workerId, String message, Throwable cause) {
        super("WORKER_FAILURE", message, cause);
        this.workerId = workerId;
    }

    public String workerId() { return workerId; }
}
