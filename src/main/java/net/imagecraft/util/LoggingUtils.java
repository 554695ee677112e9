package net.imagecraft.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Helpers for logging warnings and errors with an optional trailing cause, and for turning
 * failures into the short messages stored on batch results.
 */
public final class LoggingUtils {

    private static final int MAX_SUMMARY_LENGTH = 300;

    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger != null && message != null) {
            logger.error(message, withCause(throwable, args));
        }
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger != null && message != null) {
            logger.warn(message, withCause(throwable, args));
        }
    }

    /**
     * One-line description of a failure: the innermost non-blank message, or the exception's
     * simple name when no message exists. Long messages are truncated.
     */
    public static String summarize(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            Throwable cause = throwable.getCause();
            if (cause != null && cause != throwable) {
                return summarize(cause);
            }
            message = throwable.getClass().getSimpleName();
        }
        message = message.strip();
        return message.length() > MAX_SUMMARY_LENGTH ? message.substring(0, MAX_SUMMARY_LENGTH) + "..." : message;
    }

    // SLF4J treats a trailing Throwable argument as the cause
    private static Object[] withCause(Throwable throwable, Object... args) {
        Object[] base = args == null ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] finalArgs = Arrays.copyOf(base, base.length + 1);
        finalArgs[finalArgs.length - 1] = throwable;
        return finalArgs;
    }
}
