package io.github.yok.dbbridge.db;

import com.google.common.base.Preconditions;
import io.github.yok.dbbridge.config.BackendKind;
import io.github.yok.dbbridge.config.DbConfig;
import io.github.yok.dbbridge.db.postgresql.PostgresqlDriver;
import io.github.yok.dbbridge.db.sqlite.SqliteDriver;
import io.github.yok.dbbridge.error.ConnectionException;
import io.github.yok.dbbridge.schema.SchemaManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that builds the {@link DbDriver} for a configuration.
 *
 * <p>
 * The set of backends is closed ({@link BackendKind}), so selection is a plain switch:
 * </p>
 * <ul>
 * <li>{@code SQLITE}: instantiate {@link SqliteDriver}</li>
 * <li>{@code POSTGRES}: instantiate {@link PostgresqlDriver}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbDriverFactory {

    // Shared by every driver built here
    private final SchemaManager schemaManager;

    /**
     * Creates an unconnected driver.
     *
     * @param kind backend
     * @return new driver
     */
    public DbDriver create(BackendKind kind) {
        Preconditions.checkNotNull(kind, "kind must not be null");
        switch (kind) {
            case SQLITE:
                return new SqliteDriver(schemaManager);
            case POSTGRES:
                return new PostgresqlDriver(schemaManager);
            default:
                throw new IllegalArgumentException("Unsupported backend: " + kind);
        }
    }

    /**
     * Creates the driver for {@code config} and connects it.
     *
     * <p>
     * The caller owns the returned driver and must close it.
     * </p>
     *
     * @param config connection settings
     * @return connected driver
     * @throws ConnectionException if the driver cannot be connected; no pool is left open
     */
    public DbDriver connect(DbConfig config) {
        Preconditions.checkNotNull(config, "config must not be null");
        if (config.getKind() == null) {
            throw new ConnectionException("Database driver kind is not configured.");
        }
        DbDriver driver = create(config.getKind());
        try {
            driver.connect(config);
            return driver;
        } catch (RuntimeException e) {
            log.error("[{}] Connection failed: {}", driver.dialect(), e.getMessage());
            driver.close();
            throw e;
        }
    }
}
