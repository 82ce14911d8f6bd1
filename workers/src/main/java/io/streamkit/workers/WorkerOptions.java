package io.streamkit.workers;

import java.util.Objects;

/**
 * Thread settings for the pool's workers.
 *
 * @param namePrefix thread names are {@code namePrefix-N}
 * @param daemon     whether worker threads keep the JVM alive
 */
public record WorkerOptions(String namePrefix, boolean daemon) {
    public static final WorkerOptions DEFAULT = new WorkerOptions("streamkit-worker", true);

    public WorkerOptions {
        Objects.requireNonNull(namePrefix, "namePrefix");
    }
}
