package io.github.yok.dbbridge.db;

import java.util.OptionalLong;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a statement that does not return rows.
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
@ToString
public final class ExecResult {

    @Getter
    private final long affectedRows;

    // Boxed so that "not reported" can be told apart from 0
    private final Long lastInsertId;

    /**
     * Creates a result.
     *
     * @param affectedRows number of rows the statement changed
     * @param lastInsertId id of the last inserted row, or {@code null} when not reported
     */
    public ExecResult(long affectedRows, Long lastInsertId) {
        this.affectedRows = affectedRows;
        this.lastInsertId = lastInsertId;
    }

    /**
     * Returns the id generated by the last insert, where the dialect reports one.
     *
     * @return last insert id, or empty
     */
    public OptionalLong getLastInsertId() {
        return lastInsertId == null ? OptionalLong.empty() : OptionalLong.of(lastInsertId);
    }
}
