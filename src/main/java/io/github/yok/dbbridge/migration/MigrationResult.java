package io.github.yok.dbbridge.migration;

import com.google.common.collect.ImmutableMap;
import io.github.yok.dbbridge.error.MigrationException;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a migration run.
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
public final class MigrationResult {

    @Getter
    private final MigrationState state;

    // Insertion order follows the job's table order
    @Getter
    private final Map<String, TableResult> tables;

    private final MigrationCursor cursor;

    private final MigrationException error;

    MigrationResult(MigrationState state, Map<String, TableResult> tables, MigrationCursor cursor,
            MigrationException error) {
        this.state = state;
        this.tables = ImmutableMap.copyOf(tables);
        this.cursor = cursor;
        this.error = error;
    }

    /**
     * Returns a snapshot of the cursor taken when the run ended. Build a new job with it to resume.
     *
     * @return cursor copy, independent of the job's cursor
     */
    public MigrationCursor cursor() {
        return cursor.copy();
    }

    /**
     * Returns the failure that stopped the run.
     *
     * @return failure, empty when the state is {@link MigrationState#COMPLETED}
     */
    public Optional<MigrationException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns whether every table was transferred.
     *
     * @return {@code true} for {@link MigrationState#COMPLETED}
     */
    public boolean isCompleted() {
        return state == MigrationState.COMPLETED;
    }

    /**
     * Returns the rows transferred by this run across all tables.
     *
     * @return row count
     */
    public long getRowsTransferred() {
        return tables.values().stream().mapToLong(TableResult::getRowsTransferred).sum();
    }

    /**
     * Returns the result of one table.
     *
     * @param table table name
     * @return result, or {@code null} if the table was not part of the job
     */
    public TableResult table(String table) {
        return tables.get(table);
    }
}
