package io.github.yok.dbbridge.error;

import java.sql.SQLException;
import java.util.Optional;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Opaque wrapper of a statement execution failure.
 *
 * <p>
 * This layer does not interpret the failure; the underlying {@link SQLException} is available via
 * {@link #sqlException()} for callers (and dialects) that need the SQLSTATE or vendor code.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class QueryException extends DbBridgeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public QueryException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause underlying cause
     */
    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the first {@link SQLException} in the cause chain.
     *
     * @return the JDBC exception, or empty if the failure did not originate in JDBC
     */
    public Optional<SQLException> sqlException() {
        int index = ExceptionUtils.indexOfType(this, SQLException.class);
        if (index < 0) {
            return Optional.empty();
        }
        return Optional.of((SQLException) ExceptionUtils.getThrowableList(this).get(index));
    }
}
