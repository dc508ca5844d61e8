package io.github.yok.schedlink.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a run-fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the message and the full stack trace using SLF4J.</li>
 * <li>Writes the message and the root-cause message to {@code System.err}.</li>
 * <li>Does not terminate the JVM; the caller reports the exit status.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> THROW_INSTEAD =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of reporting" for the current thread (used by tests).
     */
    public static void throwInsteadForCurrentThread() {
        THROW_INSTEAD.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreReportingForCurrentThread() {
        THROW_INSTEAD.remove();
    }

    /**
     * Logs the given message and cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause failure that ended the run
     */
    public static void reportFatal(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(THROW_INSTEAD.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }
}
