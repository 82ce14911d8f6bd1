package io.streamkit.error;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingFailureReporterTest {
    @Test
    void logs_one_warning_per_failure() {
        Logger logger = (Logger) LoggerFactory.getLogger(LoggingFailureReporter.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        boolean additive = logger.isAdditive();
        logger.setAdditive(false);
        appender.start();
        logger.addAppender(appender);
        try {
            LoggingFailureReporter.INSTANCE.report("listener", 42, new IllegalStateException("bad value"));
        } finally {
            logger.detachAppender(appender);
            logger.setAdditive(additive);
            appender.stop();
        }

        List<ILoggingEvent> events = appender.list;
        assertEquals(1, events.size());
        ILoggingEvent event = events.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("stage=listener value=42"));
        assertNotNull(event.getThrowableProxy());
    }

    @Test
    void every_failure_kind_has_a_stable_code() {
        assertEquals("VALIDATION_ERROR", new ValidationException("x").code());
        assertEquals("QUEUE_OVERFLOW", new QueueOverflowException(3).code());
        RetryExhaustedException exhausted = new RetryExhaustedException(3, new IllegalStateException("last"));
        assertEquals(3, exhausted.attempts());
        assertEquals("last", exhausted.lastError().getMessage());
        assertEquals(List.of(1, 2), new BatchOperationException("m", List.of(1, 2), null).batch());
        assertEquals("w-1", new WorkerFailureException("w-1", "m", null).workerId());
        assertThrows(ValidationException.class, () -> ValidationException.requirePositive(0, "size"));
    }
}
