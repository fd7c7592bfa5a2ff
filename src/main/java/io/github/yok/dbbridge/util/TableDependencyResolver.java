package io.github.yok.dbbridge.util;

import io.github.yok.dbbridge.db.DbDriver;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Orders tables so that every table comes after the tables its foreign keys reference.
 *
 * <p>
 * Edges {@code parent → child} are read from {@link DatabaseMetaData#getImportedKeys} on one
 * pooled connection of the driver, then sorted with Kahn's algorithm. Ties are broken
 * alphabetically (case-insensitive) so the order is deterministic.
 * </p>
 *
 * <ul>
 * <li>References to tables outside the input list and self-references are ignored.</li>
 * <li>Names are matched case-insensitively; the first spelling in the input is kept.</li>
 * <li>Tables on a reference cycle are appended alphabetically after the acyclic part.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class TableDependencyResolver {

    @Generated
    private TableDependencyResolver() {
        throw new AssertionError("No TableDependencyResolver instances for you!");
    }

    /**
     * Orders tables parent-first using the driver's catalog metadata.
     *
     * @param driver open driver
     * @param tables tables to order; {@code null} or empty yields an empty list
     * @return input tables, each once, parents before children
     * @throws IllegalArgumentException if a table name is blank
     * @throws io.github.yok.dbbridge.error.QueryException if metadata cannot be read
     */
    public static List<String> resolveOrder(DbDriver driver, List<String> tables) {
        if (tables == null || tables.isEmpty()) {
            return new ArrayList<>();
        }
        Validate.notNull(driver, "driver must not be null");
        return driver.withConnection(conn -> resolveOrder(conn, currentSchema(conn), tables));
    }

    /**
     * Orders tables parent-first using the metadata of a connection.
     *
     * @param conn connection used for metadata only
     * @param schema schema to look tables up in; {@code null} for the driver default
     * @param tables tables to order
     * @return input tables, each once, parents before children
     * @throws SQLException if metadata cannot be read
     */
    static List<String> resolveOrder(Connection conn, String schema, List<String> tables)
            throws SQLException {
        for (String table : tables) {
            Validate.notBlank(table, "tables must not contain blank names");
        }
        // lower-case key -> first spelling from the input
        Map<String, String> names = new LinkedHashMap<>();
        for (String table : tables) {
            String previous = names.putIfAbsent(table.toLowerCase(Locale.ROOT), table);
            if (previous != null) {
                log.warn("Duplicate table '{}' (same as '{}') → ignored", table, previous);
            }
        }

        Map<String, Set<String>> children = new HashMap<>();
        Map<String, Integer> parentCount = new HashMap<>();
        for (String key : names.keySet()) {
            children.put(key, new TreeSet<>());
            parentCount.put(key, 0);
        }

        DatabaseMetaData meta = conn.getMetaData();
        String metaSchema = catalogCase(meta, schema);
        for (Map.Entry<String, String> entry : names.entrySet()) {
            String child = entry.getKey();
            try (ResultSet rs = meta.getImportedKeys(null, metaSchema,
                    catalogCase(meta, entry.getValue()))) {
                while (rs.next()) {
                    String referenced = rs.getString("PKTABLE_NAME");
                    if (referenced == null) {
                        continue;
                    }
                    String parent = referenced.toLowerCase(Locale.ROOT);
                    if (!names.containsKey(parent) || parent.equals(child)) {
                        continue;
                    }
                    if (children.get(parent).add(child)) {
                        parentCount.merge(child, 1, Integer::sum);
                        log.debug("Foreign key {} → {}", names.get(parent), entry.getValue());
                    }
                }
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        parentCount.forEach((key, count) -> {
            if (count == 0) {
                ready.offer(key);
            }
        });
        List<String> ordered = new ArrayList<>(names.size());
        while (!ready.isEmpty()) {
            String key = ready.poll();
            ordered.add(names.get(key));
            for (String child : children.get(key)) {
                if (parentCount.merge(child, -1, Integer::sum) == 0) {
                    ready.offer(child);
                }
            }
        }

        if (ordered.size() < names.size()) {
            List<String> cyclic = new ArrayList<>();
            new TreeSet<>(names.keySet()).forEach(key -> {
                if (parentCount.get(key) > 0) {
                    cyclic.add(names.get(key));
                }
            });
            log.warn("Foreign key cycle among {} → appended alphabetically", cyclic);
            ordered.addAll(cyclic);
        }
        log.info("Table order (parent-first): {}", ordered);
        return ordered;
    }

    private static String currentSchema(Connection conn) throws SQLException {
        try {
            return conn.getSchema();
        } catch (SQLFeatureNotSupportedException e) {
            log.debug("Connection has no schema concept → default schema", e);
            return null;
        }
    }

    // Unquoted identifiers are stored folded in some catalogs (lower-case in PostgreSQL)
    private static String catalogCase(DatabaseMetaData meta, String identifier)
            throws SQLException {
        if (identifier == null) {
            return null;
        }
        if (meta.storesLowerCaseIdentifiers()) {
            return identifier.toLowerCase(Locale.ROOT);
        }
        if (meta.storesUpperCaseIdentifiers()) {
            return identifier.toUpperCase(Locale.ROOT);
        }
        return identifier;
    }
}
