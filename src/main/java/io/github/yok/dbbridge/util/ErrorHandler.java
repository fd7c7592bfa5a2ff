package io.github.yok.dbbridge.util;

import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal command-line errors.
 *
 * <p>
 * Logs the failure with its stack trace through SLF4J and writes a one-line summary to
 * {@code System.err}. Ending the process is left to the caller, which uses the returned exit code.
 * Tests can switch the current thread to throwing instead.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /** Exit code for unrecoverable failures. */
    public static final int EXIT_FAILURE = 1;

    /** Exit code for invalid command-line arguments. */
    public static final int EXIT_USAGE = 2;

    private static final ThreadLocal<Boolean> THROW_ON_ERROR =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    @Generated
    private ErrorHandler() {
        throw new AssertionError("No ErrorHandler instances for you!");
    }

    /**
     * Makes {@link #fatal} throw {@link IllegalStateException} on the current thread.
     */
    public static void disableExitForCurrentThread() {
        THROW_ON_ERROR.set(Boolean.TRUE);
    }

    /**
     * Restores reporting on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        THROW_ON_ERROR.remove();
    }

    /**
     * Reports a fatal failure.
     *
     * @param message what was being done
     * @param cause failure
     * @return {@link #EXIT_FAILURE}
     * @throws IllegalStateException if throwing is enabled for the current thread
     */
    public static int fatal(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(THROW_ON_ERROR.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + ": " + ExceptionUtils.getRootCauseMessage(cause));
        return EXIT_FAILURE;
    }

    /**
     * Reports invalid command-line usage.
     *
     * @param message problem with the arguments
     * @param usage usage text printed after the message
     * @return {@link #EXIT_USAGE}
     * @throws IllegalStateException if throwing is enabled for the current thread
     */
    public static int usage(String message, String usage) {
        log.error("Invalid arguments: {}", message);
        if (Boolean.TRUE.equals(THROW_ON_ERROR.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
        System.err.println(usage);
        return EXIT_USAGE;
    }
}
