package io.streamkit.error;

public class QueueOverflowException extends StreamkitException {
    public QueueOverflowException(int limit) {
        super("QUEUE_OVERFLOW", "Queue overflow (limit " + limit + ")");
    }
}
