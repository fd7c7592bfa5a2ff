package io.github.yok.dbbridge.db;

import io.github.yok.dbbridge.config.DbConfig;
import io.github.yok.dbbridge.error.ConnectionException;
import io.github.yok.dbbridge.error.QueryException;
import io.github.yok.dbbridge.error.SchemaException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability set every database backend implements.
 *
 * <p>
 * A driver owns exactly one connection pool. It is unusable before a successful
 * {@link #connect(DbConfig)} and after {@link #close()}; calls on such a handle fail with
 * {@link ConnectionException}. The pool is safe for concurrent callers, the
 * {@link DbTransaction}s it hands out are not.
 * </p>
 *
 * <p>
 * Statements use the portable {@code ?} placeholder. JDBC binds it natively for every backend, so
 * {@link #execute}, {@link #queryMany} and {@link #queryOne} accept portable SQL as is;
 * {@link #transformQuery(String)} renders a statement in the backend's native placeholder syntax
 * for callers that hand text to the engine without binding.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDriver extends AutoCloseable {

    /**
     * Opens the connection pool and verifies it with a ping.
     *
     * <p>
     * A failed connect leaves no pool open and the handle permanently unusable.
     * </p>
     *
     * @param config connection settings, retained unchanged for the lifetime of the handle
     * @throws ConnectionException if the configuration is invalid, the handle was already
     *         connected or closed, or the database cannot be reached
     */
    void connect(DbConfig config);

    /**
     * Closes the connection pool. Calling it again is a no-op.
     */
    @Override
    void close();

    /**
     * Checks that a pooled connection is alive.
     *
     * @throws ConnectionException if the handle is not open or the database does not answer
     */
    void ping();

    /**
     * Starts a transaction on a dedicated pooled connection.
     *
     * <p>
     * The returned transaction belongs to the caller until it commits, rolls back, or is closed.
     * Every statement executed in it is bounded by what remains of {@code timeout}.
     * </p>
     *
     * @param timeout overall bound of the transaction, or {@code null} / zero for none
     * @return the open transaction
     * @throws ConnectionException if the handle is not open or no connection can be obtained
     */
    DbTransaction beginTransaction(Duration timeout);

    /**
     * Starts a transaction without a time bound.
     *
     * @return the open transaction
     * @throws ConnectionException if the handle is not open or no connection can be obtained
     */
    default DbTransaction beginTransaction() {
        return beginTransaction(null);
    }

    /**
     * Executes a statement that does not return rows.
     *
     * @param sql statement with portable placeholders
     * @param args placeholder values in order
     * @return affected rows and, where the dialect reports it, the last insert id
     * @throws QueryException if execution fails
     * @throws ConnectionException if the handle is not open
     */
    ExecResult execute(String sql, Object... args);

    /**
     * Runs a query and returns every row as a column-label to value map, in column order.
     *
     * @param sql query with portable placeholders
     * @param args placeholder values in order
     * @return rows in result order
     * @throws QueryException if execution fails
     * @throws ConnectionException if the handle is not open
     */
    List<Map<String, Object>> queryMany(String sql, Object... args);

    /**
     * Runs a query and maps every row.
     *
     * @param <T> row type
     * @param sql query with portable placeholders
     * @param mapper row mapper
     * @param args placeholder values in order
     * @return mapped rows in result order
     * @throws QueryException if execution or mapping fails
     * @throws ConnectionException if the handle is not open
     */
    <T> List<T> queryMany(String sql, RowMapper<T> mapper, Object... args);

    /**
     * Runs a query and returns its first row.
     *
     * @param sql query with portable placeholders
     * @param args placeholder values in order
     * @return the first row, or empty when the query returned none
     * @throws QueryException if execution fails
     * @throws ConnectionException if the handle is not open
     */
    Optional<Map<String, Object>> queryOne(String sql, Object... args);

    /**
     * Applies the schema source of this driver's dialect. Safe to call repeatedly.
     *
     * @throws SchemaException if the schema source is missing or a statement fails for a reason
     *         other than an already existing object
     * @throws ConnectionException if the handle is not open
     */
    void initializeSchema();

    /**
     * Returns the canonical lowercase dialect name.
     *
     * @return {@code "sqlite"} or {@code "postgres"}
     */
    String dialect();

    /**
     * Rewrites portable placeholders into the dialect's native syntax.
     *
     * <p>
     * Pure and deterministic. A statement without portable placeholders is returned unchanged.
     * </p>
     *
     * @param sql statement with portable placeholders
     * @return statement in native syntax
     */
    String transformQuery(String sql);

    /**
     * Tells whether the backend accepts concurrent writers.
     *
     * @return {@code false} for single-writer engines
     */
    boolean supportsConcurrentWriters();

    /**
     * Classifies a failure as "the object being created already exists".
     *
     * @param e failure raised by {@link #execute}
     * @return {@code true} if the failure is an object-exists condition
     */
    boolean isObjectExistsError(QueryException e);

    /**
     * Lists the user tables of the connected database, sorted by name.
     *
     * @return table names
     * @throws QueryException if the catalog cannot be read
     * @throws ConnectionException if the handle is not open
     */
    List<String> listTables();

    /**
     * Runs a callback with a pooled connection that is released on every exit path.
     *
     * @param <T> result type
     * @param callback work to perform
     * @return callback result
     * @throws QueryException if the callback raises {@link java.sql.SQLException}
     * @throws ConnectionException if the handle is not open
     */
    <T> T withConnection(ConnectionCallback<T> callback);

    /**
     * Returns the configuration the handle was connected with.
     *
     * @return configuration, or {@code null} before {@link #connect(DbConfig)}
     */
    DbConfig config();

    /**
     * Tells whether the handle is connected and not closed.
     *
     * @return {@code true} while usable
     */
    boolean isOpen();
}
