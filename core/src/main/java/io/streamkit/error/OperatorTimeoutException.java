package io.streamkit.error;

public class OperatorTimeoutException extends StreamkitException {
    public OperatorTimeoutException(long timeoutMillis) {
        this("Operation timed out after " + timeoutMillis + "ms");
    }

    public OperatorTimeoutException(String message) {
        super("OPERATOR_TIMEOUT", message);
    }
}
