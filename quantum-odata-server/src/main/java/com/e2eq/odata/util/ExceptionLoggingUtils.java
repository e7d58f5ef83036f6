package com.e2eq.odata.util;

import io.quarkus.logging.Log;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Consistent exception logging for the HTTP layer.
 */
public class ExceptionLoggingUtils {

    private ExceptionLoggingUtils() {
    }

    /**
     * Log exception with full stack trace at ERROR level
     *
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logError(Throwable exception, String message, Object... args) {
        if (exception == null) {
            Log.error(format(message, args));
            return;
        }
        Log.errorf("%s: %s%n%s", format(message, args), describe(exception), getStackTrace(exception));
    }

    /**
     * Log exception at WARN level. Client errors do not carry a stack trace.
     */
    public static void logWarn(Throwable exception, String message, Object... args) {
        if (exception == null) {
            Log.warn(format(message, args));
            return;
        }
        Log.warnf("%s: %s", format(message, args), describe(exception));
    }

    public static void logDebug(Throwable exception, String message, Object... args) {
        if (!Log.isDebugEnabled()) {
            return;
        }
        if (exception == null) {
            Log.debug(format(message, args));
            return;
        }
        Log.debugf("%s: %s%n%s", format(message, args), describe(exception), getStackTrace(exception));
    }

    public static String getStackTrace(Throwable exception) {
        return exception == null ? "" : ExceptionUtils.getStackTrace(exception);
    }

    private static String describe(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }

    private static String format(String message, Object... args) {
        return args.length > 0 ? String.format(message, args) : message;
    }
}
