package io.streamkit.error;

/** Bad operator or configuration argument, e.g. a non-positive window size. */
public class ValidationException extends StreamkitException {
    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }

    public static int requirePositive(int value, String name) {
        if (value <= 0) throw new ValidationException(name + " must be positive but was " + value);
        return value;
    }

    public static long requirePositive(long value, String name) {
        if (value <= 0) throw new ValidationException(name + " must be positive but was " + value);
        return value;
    }

    public static int requireNonNegative(int value, String name) {
        if (value < 0) throw new ValidationException(name + " must be non-negative but was " + value);
        return value;
    }

    public static long requireNonNegative(long value, String name) {
        if (value < 0) throw new ValidationException(name + " must be non-negative but was " + value);
        return value;
    }
}
