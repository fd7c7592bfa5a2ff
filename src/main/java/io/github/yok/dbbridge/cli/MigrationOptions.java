package io.github.yok.dbbridge.cli;

import io.github.yok.dbbridge.config.BackendKind;
import io.github.yok.dbbridge.config.DatabaseConfig;
import io.github.yok.dbbridge.config.DbConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.ToString;
import org.apache.commons.lang3.ObjectUtils;

/**
 * Options of one {@code migrate} invocation.
 *
 * <p>
 * Unset values ({@code null}) fall back to the {@code database.*} configuration.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class MigrationOptions {

    private ConnectionOverrides source = new ConnectionOverrides();

    private ConnectionOverrides target = new ConnectionOverrides();

    // Empty means every source table, ordered by foreign keys
    private List<String> tables = new ArrayList<>();

    private Integer batchSize;

    private Integer timeoutSeconds;

    // Total attempts per batch
    private Integer retries;

    private Integer workers;

    private boolean initSchema;

    private Path checkpoint;

    private boolean help;

    /**
     * Returns the batch size to use.
     *
     * @param defaults configured migration settings
     * @return option value, or the configured one
     */
    public int effectiveBatchSize(DatabaseConfig.MigrationProperties defaults) {
        return ObjectUtils.defaultIfNull(batchSize, defaults.getBatchSize());
    }

    /**
     * Returns the attempt timeout in seconds to use.
     *
     * @param defaults configured migration settings
     * @return option value, or the configured one
     */
    public int effectiveTimeoutSeconds(DatabaseConfig.MigrationProperties defaults) {
        return ObjectUtils.defaultIfNull(timeoutSeconds, defaults.getTimeoutSeconds());
    }

    /**
     * Returns the attempts per batch to use.
     *
     * @param defaults configured migration settings
     * @return option value, or the configured one
     */
    public int effectiveRetries(DatabaseConfig.MigrationProperties defaults) {
        return ObjectUtils.defaultIfNull(retries, defaults.getRetryAttempts());
    }

    /**
     * Returns the worker count to use.
     *
     * @param defaults configured migration settings
     * @return option value, or the configured one
     */
    public int effectiveWorkers(DatabaseConfig.MigrationProperties defaults) {
        return ObjectUtils.defaultIfNull(workers, defaults.getWorkers());
    }

    /**
     * Connection values given on the command line for one side of the migration.
     */
    @Data
    public static class ConnectionOverrides {
        private String driver;
        private String path;
        private String host;
        private Integer port;
        private String user;
        @ToString.Exclude
        private String password;
        private String dbname;
        private String sslmode;
        private String schemaLocation;

        /**
         * Merges these overrides over configured connection properties.
         *
         * @param base configured properties
         * @return driver configuration
         * @throws IllegalArgumentException if no supported driver is given either way
         */
        public DbConfig applyTo(DatabaseConfig.ConnectionProperties base) {
            return DbConfig.builder()
                    .kind(BackendKind.fromValue(
                            ObjectUtils.defaultIfNull(driver, base.getDriver())))
                    .path(ObjectUtils.defaultIfNull(path, base.getPath()))
                    .host(ObjectUtils.defaultIfNull(host, base.getHost()))
                    .port(ObjectUtils.defaultIfNull(port, base.getPort()))
                    .user(ObjectUtils.defaultIfNull(user, base.getUser()))
                    .password(ObjectUtils.defaultIfNull(password, base.getPassword()))
                    .database(ObjectUtils.defaultIfNull(dbname, base.getDbname()))
                    .sslMode(ObjectUtils.defaultIfNull(sslmode, base.getSslmode()))
                    .maxOpenConns(base.getMaxOpenConns())
                    .maxIdleConns(base.getMaxIdleConns())
                    .connMaxLifetime(base.getConnMaxLifetime())
                    .connectionTimeout(base.getConnectionTimeout())
                    .schemaLocation(ObjectUtils.defaultIfNull(schemaLocation,
                            base.getSchemaLocation()))
                    .build()
                    .validate();
        }
    }
}
