package io.github.yok.dbbridge.db;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * JDBC plumbing shared by drivers and transactions.
 *
 * @author Yasuharu.Okawauchi
 */
final class JdbcSupport {

    // Maximum statement length echoed in exception messages
    private static final int MAX_SQL_IN_MESSAGE = 200;

    /**
     * Prevents instantiation.
     */
    @Generated
    private JdbcSupport() {
        throw new AssertionError("No io.github.yok.dbbridge.db.JdbcSupport instances for you!");
    }

    /**
     * Binds placeholder values, 1-based.
     *
     * @param ps prepared statement
     * @param args values, may be {@code null} for none
     * @throws SQLException if binding fails
     */
    static void bind(PreparedStatement ps, Object[] args) throws SQLException {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length; i++) {
            ps.setObject(i + 1, args[i]);
        }
    }

    /**
     * Reads every remaining row through a mapper.
     *
     * @param <T> row type
     * @param rs result set
     * @param mapper row mapper
     * @return mapped rows
     * @throws SQLException if reading fails
     */
    static <T> List<T> mapRows(ResultSet rs, RowMapper<T> mapper) throws SQLException {
        List<T> rows = new ArrayList<>();
        int rowNum = 0;
        while (rs.next()) {
            rows.add(mapper.mapRow(rs, rowNum++));
        }
        return rows;
    }

    /**
     * Maps the current row to a column-label to value map in column order.
     *
     * @param rs result set
     * @param rowNum ignored
     * @return row map
     * @throws SQLException if reading fails
     */
    static Map<String, Object> toMap(ResultSet rs, int rowNum) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        Map<String, Object> row = new LinkedHashMap<>(count * 2);
        for (int i = 1; i <= count; i++) {
            row.put(meta.getColumnLabel(i), rs.getObject(i));
        }
        return row;
    }

    /**
     * Returns the update count of an executed statement, {@code 0} if it produced rows.
     *
     * @param ps executed statement
     * @param hasResultSet value returned by {@link PreparedStatement#execute()}
     * @return affected rows
     * @throws SQLException if the count cannot be read
     */
    static long updateCount(PreparedStatement ps, boolean hasResultSet) throws SQLException {
        if (hasResultSet) {
            return 0L;
        }
        return Math.max(0, ps.getUpdateCount());
    }

    /**
     * Shortens a statement for exception messages.
     *
     * @param sql statement
     * @return abbreviated statement
     */
    static String abbreviate(String sql) {
        return StringUtils.abbreviate(StringUtils.normalizeSpace(sql), MAX_SQL_IN_MESSAGE);
    }
}
