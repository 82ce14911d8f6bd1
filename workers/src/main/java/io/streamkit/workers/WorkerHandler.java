package io.streamkit.workers;

import java.util.List;

/**
 * The code a worker thread runs for each task. A thrown {@link Exception} fails only that task; an
 * {@link Error} kills the worker, which the pool then replaces.
 */
@FunctionalInterface
public interface WorkerHandler<P, R> {
    R handle(P payload) throws Exception;

    /** Variant that also sees the parts handed over with the payload. */
    default R handle(P payload, List<?> transferables) throws Exception {
        return handle(payload);
    }
}
