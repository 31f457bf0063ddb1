package io.github.yok.csvreconciler.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports the failures that end a reconciliation run.
 *
 * <p>
 * Only two paths lead here, both from {@code Main}:
 * </p>
 * <ul>
 * <li>startup checks, such as a missing {@code POSTGRES_*} connection setting or an unsupported
 * dialect, before any entity is read;</li>
 * <li>the end-of-run flush of the error ledger into the {@code errors} table, which cannot itself
 * be recorded anywhere.</li>
 * </ul>
 *
 * <p>
 * Row and entity failures are recorded in the
 * {@link io.github.yok.csvreconciler.core.ErrorLedger} and never reach this class.
 * </p>
 *
 * <p>
 * The full stack trace goes to the application log; the operator console ({@code System.err})
 * gets the message and the root cause only. The process exit status is set by {@code Main}, not
 * here. Tests can make the current thread throw {@link IllegalStateException} instead.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Makes fatal reports on the current thread throw instead of printing to the console.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Clears the flag set by {@link #disableExitForCurrentThread()}.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports a fatal failure of the run, e.g. {@code Fatal error: <cause message>}.
     *
     * @param message operator-facing message
     * @param cause failure that ended the run; its root cause is echoed to the console
     * @throws IllegalStateException wrapping {@code cause}, when reporting is disabled for the
     *         current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Reports a fatal condition that has no underlying exception.
     *
     * @param message operator-facing message
     * @throws IllegalStateException when reporting is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
