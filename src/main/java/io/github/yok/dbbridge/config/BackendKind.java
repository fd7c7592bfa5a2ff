package io.github.yok.dbbridge.config;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Enumerates the supported database backends.
 *
 * <ul>
 * <li>SQLITE: embedded single-file engine, one writer at a time</li>
 * <li>POSTGRES: client/server engine with concurrent writers</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum BackendKind {
    // Embedded engine backed by a single database file
    SQLITE("sqlite"),
    // Client/server engine reached over the network
    POSTGRES("postgres");

    /**
     * Canonical lowercase dialect name.
     */
    private final String dialect;

    /**
     * Resolves a backend from a configuration value.
     *
     * <p>
     * Matching is case-insensitive and accepts the common aliases {@code sqlite3},
     * {@code postgresql} and {@code pgsql}.
     * </p>
     *
     * @param value configured backend name
     * @return resolved backend
     * @throws IllegalArgumentException if the value is blank or not a supported backend
     */
    public static BackendKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Database driver is not configured.");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "sqlite":
            case "sqlite3":
                return SQLITE;
            case "postgres":
            case "postgresql":
            case "pgsql":
                return POSTGRES;
            default:
                throw new IllegalArgumentException("Unsupported database driver: " + value);
        }
    }
}
