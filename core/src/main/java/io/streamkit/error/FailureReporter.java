package io.streamkit.error;

/**
 * Receives failures that have nowhere else to go, e.g. a listener that threw without its own error handler.
 */
@FunctionalInterface
public interface FailureReporter {
    void report(String stage, Object value, Throwable error);
}
