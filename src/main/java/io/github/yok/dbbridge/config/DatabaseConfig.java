package io.github.yok.dbbridge.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code database} section of {@code application.yml}.
 *
 * <pre>
 * database:
 *   source:
 *     driver: sqlite
 *     path: ./data/app.db
 *   target:
 *     driver: postgres
 *     host: localhost
 *     port: 5432
 *     user: app
 *     password: secret
 *     dbname: app
 *     sslmode: disable
 *   migration:
 *     batch-size: 500
 *     timeout-seconds: 30
 *     retry-attempts: 3
 * </pre>
 *
 * <p>
 * The bound values are mutable; drivers only ever receive the immutable {@link DbConfig} produced
 * by {@link ConnectionProperties#toDbConfig()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "database")
@Data
public class DatabaseConfig {

    /**
     * Connection the application (and a migration) reads from.
     */
    private ConnectionProperties source = new ConnectionProperties();

    /**
     * Connection a migration writes to.
     */
    private ConnectionProperties target = new ConnectionProperties();

    /**
     * Migration tuning.
     */
    private MigrationProperties migration = new MigrationProperties();

    /**
     * Inner class that holds one connection setting.
     */
    @Data
    public static class ConnectionProperties {
        // Backend name (sqlite / postgres)
        private String driver;
        // SQLite database file
        private String path;
        // PostgreSQL host name
        private String host;
        // PostgreSQL port
        private int port = 5432;
        // PostgreSQL user
        private String user;
        // PostgreSQL password
        private String password;
        // PostgreSQL database name
        private String dbname;
        // PostgreSQL SSL mode (disable, require, verify-full, ...)
        private String sslmode = "disable";
        // Maximum open connections in the pool
        private int maxOpenConns = 10;
        // Idle connections the pool keeps open (HikariCP minimumIdle: a floor, not a cap)
        private int maxIdleConns = 5;
        // Maximum lifetime of a pooled connection
        private Duration connMaxLifetime = Duration.ofMinutes(30);
        // Maximum wait for a pooled connection
        private Duration connectionTimeout = Duration.ofSeconds(30);
        // Location of the schema files
        private String schemaLocation = DbConfig.DEFAULT_SCHEMA_LOCATION;

        /**
         * Converts the bound values into an immutable {@link DbConfig}.
         *
         * @return driver configuration
         * @throws IllegalArgumentException if {@code driver} is blank or unsupported
         */
        public DbConfig toDbConfig() {
            return DbConfig.builder()
                    .kind(BackendKind.fromValue(driver))
                    .path(path)
                    .host(host)
                    .port(port)
                    .user(user)
                    .password(password)
                    .database(dbname)
                    .sslMode(sslmode)
                    .maxOpenConns(maxOpenConns)
                    .maxIdleConns(maxIdleConns)
                    .connMaxLifetime(connMaxLifetime)
                    .connectionTimeout(connectionTimeout)
                    .schemaLocation(schemaLocation)
                    .build();
        }
    }

    /**
     * Inner class that holds migration tuning values.
     */
    @Data
    public static class MigrationProperties {
        // Rows per target transaction
        private int batchSize = 500;
        // Bound of one batch attempt, in seconds
        private int timeoutSeconds = 30;
        // Total attempts per batch
        private int retryAttempts = 3;
        // Pause between two attempts of the same batch
        private Duration retryBackoff = Duration.ofMillis(500);
        // Concurrent batch workers (honoured only for targets with concurrent writers)
        private int workers = 1;
    }
}
