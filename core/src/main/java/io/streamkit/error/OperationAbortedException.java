package io.streamkit.error;

/** Raised when a cancellation token fires or a waiting thread is interrupted. */
public class OperationAbortedException extends StreamkitException {
    public OperationAbortedException() {
        this("Operation was aborted");
    }

    public OperationAbortedException(String message) {
        super("ABORT_ERR", message);
    }

    public OperationAbortedException(String message, Throwable cause) {
        super("ABORT_ERR", message, cause);
    }

    /** Restores the interrupt flag and converts the interruption into an abort. */
    public static OperationAbortedException interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        return new OperationAbortedException("Interrupted while waiting", e);
    }
}
