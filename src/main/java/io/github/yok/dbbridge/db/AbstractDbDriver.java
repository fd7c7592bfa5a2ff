package io.github.yok.dbbridge.db;

import com.google.common.base.Preconditions;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.dbbridge.config.BackendKind;
import io.github.yok.dbbridge.config.DbConfig;
import io.github.yok.dbbridge.error.ConnectionException;
import io.github.yok.dbbridge.error.QueryException;
import io.github.yok.dbbridge.schema.SchemaManager;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared implementation of {@link DbDriver} on top of a HikariCP pool.
 *
 * <p>
 * Handles the handle lifecycle ({@code NEW → OPEN → CLOSED}), statement execution, row mapping,
 * transactions and schema application. Subclasses contribute the dialect: pool configuration,
 * placeholder rewriting, "already exists" classification and catalog queries.
 * </p>
 *
 * <p>
 * A failed {@link #connect(DbConfig)} closes whatever pool was started and moves the handle to
 * {@code CLOSED}; the handle is never marked usable unless the pool answered a ping.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class AbstractDbDriver implements DbDriver {

    // Hikari rejects connection timeouts below 250 ms
    private static final long MIN_CONNECTION_TIMEOUT_MS = 250L;

    private static final int PING_TIMEOUT_SECONDS = 5;

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private enum State {
        NEW, OPEN, CLOSED
    }

    private final BackendKind kind;

    private final SchemaManager schemaManager;

    private final Object lifecycleLock = new Object();

    private volatile State state = State.NEW;

    private volatile HikariDataSource dataSource;

    private volatile DbConfig config;

    /**
     * Constructs a driver for a backend.
     *
     * @param kind backend implemented by the subclass
     * @param schemaManager applies the schema on {@link #initializeSchema()}
     */
    protected AbstractDbDriver(BackendKind kind, SchemaManager schemaManager) {
        this.kind = Preconditions.checkNotNull(kind, "kind must not be null");
        this.schemaManager = Preconditions.checkNotNull(schemaManager,
                "schemaManager must not be null");
    }

    @Override
    public final void connect(DbConfig config) {
        Preconditions.checkNotNull(config, "config must not be null");
        synchronized (lifecycleLock) {
            if (state != State.NEW) {
                throw new ConnectionException(
                        "[" + dialect() + "] driver cannot be connected again (state=" + state
                                + ")");
            }
            HikariDataSource ds = null;
            try {
                validate(config);
                beforeConnect(config);
                ds = new HikariDataSource(buildPoolConfig(config));
                ping(ds);
                this.dataSource = ds;
                this.config = config;
                this.state = State.OPEN;
                log.info("[{}] Connected (pool={}, maxPoolSize={})", dialect(), ds.getPoolName(),
                        ds.getMaximumPoolSize());
            } catch (ConnectionException e) {
                abortConnect(ds);
                throw e;
            } catch (RuntimeException e) {
                abortConnect(ds);
                throw new ConnectionException(
                        "[" + dialect() + "] failed to connect: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public final void close() {
        HikariDataSource ds;
        synchronized (lifecycleLock) {
            if (state == State.CLOSED) {
                log.debug("[{}] close() called on a closed driver → ignored", dialect());
                return;
            }
            state = State.CLOSED;
            ds = dataSource;
            dataSource = null;
        }
        if (ds != null) {
            ds.close();
            log.info("[{}] Connection pool closed ({})", dialect(), ds.getPoolName());
        }
    }

    @Override
    public final void ping() {
        ping(requireOpen());
    }

    @Override
    public final DbTransaction beginTransaction(Duration timeout) {
        HikariDataSource ds = requireOpen();
        Connection connection;
        try {
            connection = ds.getConnection();
        } catch (SQLException e) {
            throw new ConnectionException(
                    "[" + dialect() + "] failed to obtain a connection for a transaction", e);
        }
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            closeQuietly(connection);
            throw new ConnectionException("[" + dialect() + "] failed to start a transaction", e);
        }
        return new JdbcTransaction(this, connection, timeout);
    }

    @Override
    public final ExecResult execute(String sql, Object... args) {
        Preconditions.checkNotNull(sql, "sql must not be null");
        HikariDataSource ds = requireOpen();
        try (Connection connection = ds.getConnection()) {
            return executeOn(connection, sql, args, 0, null);
        } catch (SQLException e) {
            throw new QueryException("Statement failed: " + JdbcSupport.abbreviate(sql), e);
        }
    }

    @Override
    public final List<Map<String, Object>> queryMany(String sql, Object... args) {
        return queryMany(sql, JdbcSupport::toMap, args);
    }

    @Override
    public final <T> List<T> queryMany(String sql, RowMapper<T> mapper, Object... args) {
        Preconditions.checkNotNull(sql, "sql must not be null");
        Preconditions.checkNotNull(mapper, "mapper must not be null");
        HikariDataSource ds = requireOpen();
        try (Connection connection = ds.getConnection();
                PreparedStatement ps = connection.prepareStatement(sql)) {
            JdbcSupport.bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                return JdbcSupport.mapRows(rs, mapper);
            }
        } catch (SQLException e) {
            throw new QueryException("Query failed: " + JdbcSupport.abbreviate(sql), e);
        }
    }

    @Override
    public final Optional<Map<String, Object>> queryOne(String sql, Object... args) {
        Preconditions.checkNotNull(sql, "sql must not be null");
        HikariDataSource ds = requireOpen();
        try (Connection connection = ds.getConnection();
                PreparedStatement ps = connection.prepareStatement(sql)) {
            JdbcSupport.bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(JdbcSupport.toMap(rs, 0));
            }
        } catch (SQLException e) {
            throw new QueryException("Query failed: " + JdbcSupport.abbreviate(sql), e);
        }
    }

    @Override
    public final void initializeSchema() {
        requireOpen();
        schemaManager.apply(this);
    }

    @Override
    public final <T> T withConnection(ConnectionCallback<T> callback) {
        Preconditions.checkNotNull(callback, "callback must not be null");
        HikariDataSource ds = requireOpen();
        try (Connection connection = ds.getConnection()) {
            return callback.doInConnection(connection);
        } catch (SQLException e) {
            throw new QueryException("[" + dialect() + "] connection callback failed", e);
        }
    }

    @Override
    public final String dialect() {
        return kind.getDialect();
    }

    @Override
    public final DbConfig config() {
        return config;
    }

    @Override
    public final boolean isOpen() {
        return state == State.OPEN;
    }

    /**
     * Returns the backend implemented by this driver.
     *
     * @return backend kind
     */
    public final BackendKind kind() {
        return kind;
    }

    /**
     * Applies the dialect's pool settings: JDBC URL, driver class, credentials, pool limits and
     * driver properties. Pool name and connection timeout are already set.
     *
     * @param hikari pool configuration to fill
     * @param config connection settings
     */
    protected abstract void configurePool(HikariConfig hikari, DbConfig config);

    /**
     * Hook run before the pool is started.
     *
     * @param config connection settings
     * @throws ConnectionException if the environment cannot be prepared
     */
    protected void beforeConnect(DbConfig config) {
        // nothing by default
    }

    /**
     * Reports the id generated by the statement just executed on {@code connection}.
     *
     * @param connection connection the statement ran on
     * @param sql executed statement
     * @return last insert id, or empty when the dialect does not report one
     * @throws SQLException if the id cannot be read
     */
    protected OptionalLong lastInsertId(Connection connection, String sql) throws SQLException {
        return OptionalLong.empty();
    }

    /**
     * Executes one statement on a connection the caller owns.
     *
     * @param connection connection to use
     * @param sql statement
     * @param args placeholder values
     * @param timeoutSeconds JDBC query timeout, {@code 0} for none
     * @param tracker receives the statement before it runs so it can be cancelled, may be
     *        {@code null}
     * @return execution result
     * @throws SQLException if execution fails
     */
    final ExecResult executeOn(Connection connection, String sql, Object[] args,
            int timeoutSeconds, StatementTracker tracker) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            if (tracker != null) {
                tracker.track(ps);
            }
            try {
                if (timeoutSeconds > 0) {
                    ps.setQueryTimeout(timeoutSeconds);
                }
                JdbcSupport.bind(ps, args);
                long affected = JdbcSupport.updateCount(ps, ps.execute());
                OptionalLong id = lastInsertId(connection, sql);
                log.debug("[{}] Executed: {} (affected={})", dialect(),
                        JdbcSupport.abbreviate(sql), affected);
                return new ExecResult(affected, id.isPresent() ? id.getAsLong() : null);
            } finally {
                if (tracker != null) {
                    tracker.untrack();
                }
            }
        }
    }

    private void validate(DbConfig config) {
        if (config.getKind() != kind) {
            throw new ConnectionException("[" + dialect() + "] driver cannot connect a "
                    + config.getKind() + " configuration");
        }
        try {
            config.validate();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConnectionException(
                    "[" + dialect() + "] invalid configuration: " + e.getMessage(), e);
        }
    }

    private HikariConfig buildPoolConfig(DbConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("dbbridge-" + dialect() + "-" + POOL_SEQUENCE.incrementAndGet());
        hikari.setConnectionTimeout(
                Math.max(MIN_CONNECTION_TIMEOUT_MS, config.getConnectionTimeout().toMillis()));
        hikari.setMaxLifetime(config.getConnMaxLifetime().toMillis());
        configurePool(hikari, config);
        return hikari;
    }

    private void ping(HikariDataSource ds) {
        try (Connection connection = ds.getConnection()) {
            if (!connection.isValid(PING_TIMEOUT_SECONDS)) {
                throw new ConnectionException("[" + dialect() + "] ping failed: connection is "
                        + "not valid");
            }
        } catch (SQLException e) {
            throw new ConnectionException("[" + dialect() + "] ping failed: " + e.getMessage(), e);
        }
    }

    private HikariDataSource requireOpen() {
        State current = state;
        HikariDataSource ds = dataSource;
        if (current != State.OPEN || ds == null) {
            throw new ConnectionException("[" + dialect() + "] driver is "
                    + (current == State.NEW ? "not connected" : "closed"));
        }
        return ds;
    }

    private void abortConnect(HikariDataSource ds) {
        state = State.CLOSED;
        if (ds != null) {
            ds.close();
        }
    }

    private void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[{}] Failed to release connection: {}", dialect(), e.getMessage(), e);
        }
    }

    /**
     * Receives the statement currently running so that another thread can cancel it.
     */
    interface StatementTracker {

        /**
         * Registers the running statement.
         *
         * @param statement statement about to run
         */
        void track(Statement statement);

        /**
         * Clears the registration once the statement finished.
         */
        void untrack();
    }
}
