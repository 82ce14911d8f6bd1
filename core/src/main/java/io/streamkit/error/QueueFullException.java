package io.streamkit.error;

public class QueueFullException extends StreamkitException {
    public QueueFullException(int maxQueueSize) {
        super("QUEUE_FULL", "Worker pool queue is full (max " + maxQueueSize + ")");
    }
}
