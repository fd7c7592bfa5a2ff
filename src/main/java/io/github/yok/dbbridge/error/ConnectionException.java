package io.github.yok.dbbridge.error;

/**
 * Raised when a driver cannot be connected, pinged, or used.
 *
 * <p>
 * Covers database-directory creation, pool start-up, ping failures, and any call on a handle that
 * is not open (never connected, or already closed). A handle that raised this exception from
 * {@code connect} must not be reused.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ConnectionException extends DbBridgeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public ConnectionException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause underlying cause
     */
    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
