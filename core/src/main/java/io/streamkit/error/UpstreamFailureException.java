package io.streamkit.error;

/** A source, future or queue producer failed with a checked exception; the original travels as the cause. */
public class UpstreamFailureException extends StreamkitException {
    public UpstreamFailureException(Throwable cause) {
        super("UPSTREAM_FAILURE", String.valueOf(cause), cause);
    }
}
