package io.github.yok.dbbridge.error;

import lombok.Getter;

/**
 * Raised when a migration batch exhausted its attempts, or the migration was interrupted.
 *
 * <p>
 * Carries the table name and the offset of the last committed batch for that table, which is the
 * offset a resumed run starts from.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class MigrationException extends DbBridgeException {

    private static final long serialVersionUID = 1L;

    private final String table;

    private final long committedOffset;

    /**
     * Creates an exception for a table.
     *
     * @param table table being migrated
     * @param committedOffset offset of the last committed row boundary for {@code table}
     * @param message detail message
     * @param cause last failure
     */
    public MigrationException(String table, long committedOffset, String message,
            Throwable cause) {
        super(message + " (table=" + table + ", committedOffset=" + committedOffset + ")", cause);
        this.table = table;
        this.committedOffset = committedOffset;
    }
}
