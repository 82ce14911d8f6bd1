package io.streamkit.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default reporter: one WARN line per failure, stack trace included. */
public final class LoggingFailureReporter implements FailureReporter {
    public static final LoggingFailureReporter INSTANCE = new LoggingFailureReporter();

    private static final Logger log = LoggerFactory.getLogger(LoggingFailureReporter.class);

    private LoggingFailureReporter() {}

    @Override
    public void report(String stage, Object value, Throwable error) {
        log.warn("stage={} value={} failed: {}", stage, value, error.toString(), error);
    }
}
