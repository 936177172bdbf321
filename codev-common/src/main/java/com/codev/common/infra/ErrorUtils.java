package com.codev.common.infra;

/**
 * Error formatting utilities: safely extract readable messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Walk the cause chain down to the innermost throwable.
     * Netty and the JDK HTTP client wrap the interesting failure (refused connection,
     * TLS alert) in one or more layers.
     */
    public static Throwable rootCause(Throwable err) {
        if (err == null)
            return null;
        Throwable current = err;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Format the innermost cause of an exception.
     */
    public static String formatRootCause(Throwable err) {
        return formatErrorMessage(rootCause(err));
    }
}
