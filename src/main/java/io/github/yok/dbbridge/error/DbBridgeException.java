package io.github.yok.dbbridge.error;

/**
 * Base type of every failure raised by the database layer.
 *
 * <p>
 * All subclasses are unchecked. JDBC {@link java.sql.SQLException}s are caught at the driver
 * boundary and re-thrown as one of the subclasses with the original exception kept as cause.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DbBridgeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public DbBridgeException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause underlying cause
     */
    public DbBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
