package io.github.yok.dbbridge.db;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps the current row of a {@link ResultSet}.
 *
 * @param <T> row type
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface RowMapper<T> {

    /**
     * Maps the row the result set is positioned on. Implementations must not move the cursor.
     *
     * @param rs result set
     * @param rowNum 0-based row number
     * @return mapped value
     * @throws SQLException if a column cannot be read
     */
    T mapRow(ResultSet rs, int rowNum) throws SQLException;
}
