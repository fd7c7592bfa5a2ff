package io.github.yok.dbbridge.migration;

/**
 * Callback invoked after a batch has been committed on the target and recorded in the cursor.
 *
 * <p>
 * Called from the thread that ran the batch; implementations must be thread-safe when the job uses
 * more than one worker. A failing listener is logged and does not affect the batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface BatchCommitListener {

    /**
     * Listener that does nothing.
     */
    BatchCommitListener NONE = (table, range, cursor) -> {
    };

    /**
     * Handles a committed batch.
     *
     * @param table table name
     * @param range rows committed
     * @param cursor job cursor, already advanced
     */
    void onCommitted(String table, RowRange range, MigrationCursor cursor);
}
