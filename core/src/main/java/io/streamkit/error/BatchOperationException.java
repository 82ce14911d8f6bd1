package io.streamkit.error;

import java.util.List;

/** Upstream failure while a batch was partially filled; the buffered items travel with the error. */
public class BatchOperationException extends StreamkitException {
    private final List<?> batch;

    public BatchOperationException(String message, List<?> batch, Throwable cause) {
        super("BATCH_OPERATION_FAILED", message, cause);
        this.batch = List.copyOf(batch);
    }

    public List<?> batch() { return batch; }
}
