package io.github.yok.dbbridge.db.postgresql;

import com.google.common.collect.ImmutableSet;
import com.zaxxer.hikari.HikariConfig;
import io.github.yok.dbbridge.config.BackendKind;
import io.github.yok.dbbridge.config.DbConfig;
import io.github.yok.dbbridge.db.AbstractDbDriver;
import io.github.yok.dbbridge.error.QueryException;
import io.github.yok.dbbridge.schema.SchemaManager;
import io.github.yok.dbbridge.util.SqlScripts;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Driver for the PostgreSQL client/server engine.
 *
 * <p>
 * The pool is sized from the configuration ({@code maxOpenConns} connections at most,
 * {@code maxIdleConns} as HikariCP's {@code minimumIdle} floor) and connections are retired after
 * {@code connMaxLifetime}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PostgresqlDriver extends AbstractDbDriver {

    /**
     * SQLSTATEs raised when the object being created already exists: duplicate_table,
     * duplicate_schema, duplicate_object, duplicate_function, duplicate_column.
     */
    static final Set<String> OBJECT_EXISTS_STATES =
            ImmutableSet.of("42P07", "42P06", "42710", "42723", "42701");

    /**
     * Constructs an unconnected PostgreSQL driver.
     *
     * @param schemaManager applies the schema on {@link #initializeSchema()}
     */
    public PostgresqlDriver(SchemaManager schemaManager) {
        super(BackendKind.POSTGRES, schemaManager);
    }

    @Override
    protected void configurePool(HikariConfig hikari, DbConfig config) {
        hikari.setJdbcUrl(buildJdbcUrl(config));
        hikari.setDriverClassName("org.postgresql.Driver");
        hikari.setUsername(config.getUser());
        hikari.setPassword(config.getPassword());
        hikari.setMaximumPoolSize(config.getMaxOpenConns());
        hikari.setMinimumIdle(Math.min(config.getMaxIdleConns(), config.getMaxOpenConns()));
        long connectTimeoutSeconds = Math.max(1L, config.getConnectionTimeout().toSeconds());
        hikari.addDataSourceProperty("connectTimeout", String.valueOf(connectTimeoutSeconds));
        log.debug("[postgres] Pool configured: url={}, user={}, maxOpen={}, maxIdle={}",
                hikari.getJdbcUrl(), config.getUser(), config.getMaxOpenConns(),
                config.getMaxIdleConns());
    }

    /**
     * Rewrites each {@code ?} into {@code $1}, {@code $2}, … from left to right.
     *
     * <p>
     * Question marks inside string literals, quoted identifiers, comments and dollar-quoted bodies
     * are kept.
     * </p>
     *
     * @param sql statement with portable placeholders
     * @return statement with positional markers
     */
    @Override
    public String transformQuery(String sql) {
        return SqlScripts.replacePlaceholders(sql, n -> "$" + n);
    }

    @Override
    public boolean supportsConcurrentWriters() {
        return true;
    }

    @Override
    public boolean isObjectExistsError(QueryException e) {
        return e.sqlException().map(SQLException::getSQLState)
                .map(OBJECT_EXISTS_STATES::contains).orElse(false);
    }

    @Override
    public List<String> listTables() {
        return queryMany("SELECT table_name FROM information_schema.tables "
                + "WHERE table_schema = current_schema() AND table_type = 'BASE TABLE' "
                + "ORDER BY table_name", (rs, rowNum) -> rs.getString(1));
    }

    /**
     * Builds the connection string.
     *
     * <p>
     * {@code stringtype=unspecified} lets the server infer the type of string parameters, so
     * values read from SQLite as text bind to date, time and numeric columns. Credentials are
     * passed to the pool, not embedded in the URL.
     * </p>
     *
     * @param config connection settings
     * @return JDBC URL
     */
    static String buildJdbcUrl(DbConfig config) {
        return "jdbc:postgresql://" + config.getHost() + ":" + config.getPort() + "/"
                + URLEncoder.encode(config.getDatabase(), StandardCharsets.UTF_8) + "?sslmode="
                + URLEncoder.encode(config.getSslMode(), StandardCharsets.UTF_8)
                + "&stringtype=unspecified";
    }
}
