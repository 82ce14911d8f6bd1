package io.streamkit.error;

/**
 * Root of every failure raised by the toolkit. Each subtype carries a stable {@link #code()} so callers
 * can branch on the failure kind without string matching.
 */
public class StreamkitException extends RuntimeException {
    private final String code;

    public StreamkitException(String code, String message) {
        this(code, message, null);
    }

    public StreamkitException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() { return code; }
}
