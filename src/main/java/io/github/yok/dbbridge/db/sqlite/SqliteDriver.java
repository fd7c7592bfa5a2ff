package io.github.yok.dbbridge.db.sqlite;

import com.zaxxer.hikari.HikariConfig;
import io.github.yok.dbbridge.config.BackendKind;
import io.github.yok.dbbridge.config.DbConfig;
import io.github.yok.dbbridge.db.AbstractDbDriver;
import io.github.yok.dbbridge.error.ConnectionException;
import io.github.yok.dbbridge.error.QueryException;
import io.github.yok.dbbridge.schema.SchemaManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Driver for the embedded SQLite engine.
 *
 * <p>
 * <strong>Connection setup:</strong>
 * </p>
 * <ul>
 * <li>The parent directory of the database file is created when it does not exist.</li>
 * <li>Connections open with {@code journal_mode=WAL}, {@code foreign_keys=true} and a busy
 * timeout.</li>
 * <li>The pool is capped at {@value #MAX_POOL_SIZE} connection whatever {@code maxOpenConns} says.
 * SQLite serialises writers on the database file, so every caller of one handle shares the single
 * connection. This is the engine's constraint, not a tuning default.</li>
 * </ul>
 *
 * <p>
 * Portable {@code ?} placeholders are SQLite's own syntax; {@link #transformQuery(String)} is the
 * identity.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SqliteDriver extends AbstractDbDriver {

    /** Pool size enforced for SQLite. */
    public static final int MAX_POOL_SIZE = 1;

    // Wait on a locked database file before SQLITE_BUSY, in milliseconds
    static final int BUSY_TIMEOUT_MS = 5000;

    private static final String MEMORY_PATH = ":memory:";

    /**
     * Constructs an unconnected SQLite driver.
     *
     * @param schemaManager applies the schema on {@link #initializeSchema()}
     */
    public SqliteDriver(SchemaManager schemaManager) {
        super(BackendKind.SQLITE, schemaManager);
    }

    /**
     * Creates the parent directory of the database file when absent.
     *
     * @param config connection settings
     * @throws ConnectionException if the directory cannot be created
     */
    @Override
    protected void beforeConnect(DbConfig config) {
        String path = config.getPath();
        if (MEMORY_PATH.equals(path)) {
            return;
        }
        Path parent;
        try {
            parent = Paths.get(path).toAbsolutePath().getParent();
        } catch (InvalidPathException e) {
            throw new ConnectionException("[sqlite] invalid database path: " + path, e);
        }
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
            log.info("[sqlite] Created database directory: {}", parent);
        } catch (IOException e) {
            throw new ConnectionException("[sqlite] failed to create database directory: " + parent,
                    e);
        }
    }

    @Override
    protected void configurePool(HikariConfig hikari, DbConfig config) {
        if (config.getMaxOpenConns() > MAX_POOL_SIZE) {
            log.warn("[sqlite] maxOpenConns={} ignored: SQLite allows a single writer, pool capped "
                    + "at {}", config.getMaxOpenConns(), MAX_POOL_SIZE);
        }
        hikari.setJdbcUrl(jdbcUrl(config));
        hikari.setDriverClassName("org.sqlite.JDBC");
        hikari.setMaximumPoolSize(MAX_POOL_SIZE);
        hikari.setMinimumIdle(MAX_POOL_SIZE);
        // Pragmas applied by sqlite-jdbc on every new connection
        hikari.addDataSourceProperty("journal_mode", "WAL");
        hikari.addDataSourceProperty("foreign_keys", "true");
        hikari.addDataSourceProperty("busy_timeout", String.valueOf(BUSY_TIMEOUT_MS));
    }

    /**
     * Returns the identity: {@code ?} is SQLite's native placeholder.
     *
     * @param sql statement
     * @return {@code sql} unchanged
     */
    @Override
    public String transformQuery(String sql) {
        return sql;
    }

    @Override
    public boolean supportsConcurrentWriters() {
        return false;
    }

    /**
     * SQLite reports existing objects through the message of a generic {@code SQLITE_ERROR}:
     * {@code table x already exists}, {@code index x already exists},
     * {@code duplicate column name: x}.
     */
    @Override
    public boolean isObjectExistsError(QueryException e) {
        return e.sqlException().map(SQLException::getMessage).map(m -> m.toLowerCase(Locale.ROOT))
                .map(m -> m.contains("already exists") || m.contains("duplicate column name"))
                .orElse(false);
    }

    @Override
    public List<String> listTables() {
        return queryMany("SELECT name FROM sqlite_master WHERE type = 'table' "
                + "AND name NOT LIKE 'sqlite\\_%' ESCAPE '\\' ORDER BY name",
                (rs, rowNum) -> rs.getString(1));
    }

    /**
     * Reads {@code last_insert_rowid()} after {@code INSERT} and {@code REPLACE} statements.
     */
    @Override
    protected OptionalLong lastInsertId(Connection connection, String sql) throws SQLException {
        String head = StringUtils.stripStart(sql, null);
        if (!StringUtils.startsWithIgnoreCase(head, "INSERT")
                && !StringUtils.startsWithIgnoreCase(head, "REPLACE")) {
            return OptionalLong.empty();
        }
        try (Statement st = connection.createStatement();
                ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
        }
    }

    /**
     * Builds the JDBC URL of a database file.
     *
     * @param config connection settings
     * @return {@code jdbc:sqlite:<path>}
     */
    static String jdbcUrl(DbConfig config) {
        return "jdbc:sqlite:" + config.getPath();
    }
}
