package io.github.yok.dbbridge.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Work performed with a pooled connection lent by {@link DbDriver#withConnection}.
 *
 * <p>
 * The connection must not escape the callback; it is returned to the pool as soon as the callback
 * exits.
 * </p>
 *
 * @param <T> result type
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ConnectionCallback<T> {

    /**
     * Performs the work.
     *
     * @param connection pooled connection
     * @return result
     * @throws SQLException if a JDBC call fails
     */
    T doInConnection(Connection connection) throws SQLException;
}
