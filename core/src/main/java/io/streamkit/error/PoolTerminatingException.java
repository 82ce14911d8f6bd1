package io.streamkit.error;

public class PoolTerminatingException extends StreamkitException {
    public PoolTerminatingException() {
        this("Worker pool is terminating");
    }

    public PoolTerminatingException(String message) {
        super("POOL_TERMINATING", message);
    }
}
