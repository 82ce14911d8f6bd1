package io.streamkit.sequence;

/**
 * @param leading  emit the first value of a window immediately
 * @param trailing emit the latest held value once the window closes
 */
public record ThrottleOptions(boolean leading, boolean trailing) {
    public static final ThrottleOptions DEFAULT = new ThrottleOptions(true, true);
}
