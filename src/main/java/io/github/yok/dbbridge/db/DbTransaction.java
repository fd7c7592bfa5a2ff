package io.github.yok.dbbridge.db;

import io.github.yok.dbbridge.error.QueryException;
import java.util.List;
import java.util.Map;

/**
 * A transaction bound to one pooled connection.
 *
 * <p>
 * Exclusively owned by the caller that began it; only {@link #cancel()} may be called from another
 * thread. {@link #close()} rolls back anything not committed and returns the connection to the
 * pool, so transactions are meant to be used in try-with-resources blocks.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbTransaction extends AutoCloseable {

    /**
     * Executes a statement inside the transaction.
     *
     * @param sql statement with portable placeholders
     * @param args placeholder values in order
     * @return execution result
     * @throws QueryException if execution fails, the transaction is no longer active, or its
     *         deadline has passed
     */
    ExecResult execute(String sql, Object... args);

    /**
     * Executes one statement for many argument rows as a single JDBC batch.
     *
     * @param sql statement with portable placeholders
     * @param rows one argument array per execution
     * @return total affected rows
     * @throws QueryException if execution fails, the transaction is no longer active, or its
     *         deadline has passed
     */
    long executeBatch(String sql, List<Object[]> rows);

    /**
     * Runs a query inside the transaction.
     *
     * @param sql query with portable placeholders
     * @param args placeholder values in order
     * @return rows as column-label to value maps
     * @throws QueryException if execution fails, the transaction is no longer active, or its
     *         deadline has passed
     */
    List<Map<String, Object>> queryMany(String sql, Object... args);

    /**
     * Commits the transaction.
     *
     * @throws QueryException if the transaction was cancelled or already finished, or the commit
     *         fails (the transaction is then rolled back)
     */
    void commit();

    /**
     * Rolls the transaction back. No-op once it is committed or rolled back.
     *
     * @throws QueryException if the rollback fails
     */
    void rollback();

    /**
     * Aborts the transaction from any thread.
     *
     * <p>
     * Cancels the in-flight statement, if any, and guarantees that {@link #commit()} will fail.
     * </p>
     *
     * @return {@code true} if the transaction will not commit, {@code false} if a commit had
     *         already begun and the outcome belongs to the committing thread
     */
    boolean cancel();

    /**
     * Rolls back unless committed, and releases the connection. Idempotent.
     */
    @Override
    void close();
}
