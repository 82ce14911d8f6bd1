package io.streamkit.queue;

/** What a bounded queue does with an item that arrives while it is full. */
public enum OverflowPolicy {
    /** Evict the oldest buffered item, then append the new one. */
    DROP_OLD,
    /** Silently discard the incoming item. */
    DROP_NEW,
    /** Raise {@link io.streamkit.error.QueueOverflowException} and close the queue. */
    THROW
}
