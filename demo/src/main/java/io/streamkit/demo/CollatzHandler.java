package io.streamkit.demo;

import io.streamkit.workers.WorkerHandler;

/** Counts the Collatz steps from {@code n} down to 1; stands in for CPU-bound work. */
public class CollatzHandler implements WorkerHandler<Long, Long> {
    @Override
    public Long handle(Long n) {
        if (n < 1) throw new IllegalArgumentException("n must be positive but was " + n);
        long steps = 0;
        for (long v = n; v != 1; steps++) {
            v = (v % 2 == 0) ? v / 2 : 3 * v + 1;
        }
        return steps;
    }
}
