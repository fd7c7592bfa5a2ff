package io.github.yok.dbbridge.config;

import java.time.Duration;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Immutable connection and pool settings handed to a driver.
 *
 * <p>
 * Only the fields relevant to {@link #getKind()} are read: {@link #getPath()} for
 * {@link BackendKind#SQLITE}; host, port, user, password, database and SSL mode for
 * {@link BackendKind#POSTGRES}. Pool limits and the schema location apply to both.
 * </p>
 *
 * <p>
 * {@link #toString()} never includes the password.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class DbConfig {

    /** Default classpath location of schema files. */
    public static final String DEFAULT_SCHEMA_LOCATION = "classpath:schema";

    // Backend selector
    BackendKind kind;

    // SQLite database file
    String path;

    // PostgreSQL endpoint
    String host;

    @Builder.Default
    int port = 5432;

    String user;

    @ToString.Exclude
    String password;

    String database;

    @Builder.Default
    String sslMode = "disable";

    // Pool limits
    @Builder.Default
    int maxOpenConns = 10;

    /**
     * Idle connections kept open by the pool.
     *
     * <p>
     * Mapped to HikariCP {@code minimumIdle}, clamped to {@code maxOpenConns}. HikariCP keeps at
     * least this many connections open while idle and never closes an idle connection below it, so
     * the value is a floor rather than a cap. SQLite ignores it.
     * </p>
     */
    @Builder.Default
    int maxIdleConns = 5;

    @Builder.Default
    Duration connMaxLifetime = Duration.ofMinutes(30);

    @Builder.Default
    Duration connectionTimeout = Duration.ofSeconds(30);

    // Directory (Spring resource location) that holds schema_<dialect>.sql / schema.sql
    @Builder.Default
    String schemaLocation = DEFAULT_SCHEMA_LOCATION;

    /**
     * Validates the fields required by {@link #getKind()}.
     *
     * @return this instance
     * @throws IllegalArgumentException if a required field is missing or out of range
     */
    public DbConfig validate() {
        Validate.isTrue(kind != null, "Database driver kind must be set.");
        Validate.isTrue(maxOpenConns > 0, "maxOpenConns must be positive: %d", maxOpenConns);
        Validate.isTrue(maxIdleConns >= 0, "maxIdleConns must not be negative: %d", maxIdleConns);
        Validate.isTrue(connMaxLifetime != null, "connMaxLifetime must be set.");
        Validate.isTrue(connectionTimeout != null, "connectionTimeout must be set.");
        if (kind == BackendKind.SQLITE) {
            Validate.isTrue(StringUtils.isNotBlank(path), "SQLite path must be set.");
        } else {
            Validate.isTrue(StringUtils.isNotBlank(host), "PostgreSQL host must be set.");
            Validate.inclusiveBetween(1, 65535, port, "PostgreSQL port out of range: " + port);
            Validate.isTrue(StringUtils.isNotBlank(database),
                    "PostgreSQL database name must be set.");
            Validate.isTrue(StringUtils.isNotBlank(sslMode), "sslMode must be set.");
        }
        return this;
    }
}
