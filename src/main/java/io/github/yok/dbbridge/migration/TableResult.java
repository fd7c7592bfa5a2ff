package io.github.yok.dbbridge.migration;

import io.github.yok.dbbridge.error.MigrationException;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one table within a migration run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class TableResult {

    String table;

    TableState state;

    // Counted at table start; -1 when the table was not reached or could not be counted
    @Builder.Default
    long totalRows = -1L;

    // Rows and batches of this run only
    long rowsTransferred;

    int batchesCommitted;

    long committedOffset;

    @Builder.Default
    List<RowRange> committedRanges = List.of();

    MigrationException error;

    /**
     * Returns the failure that stopped the table.
     *
     * @return failure, empty unless the state is {@link TableState#FAILED}
     */
    public Optional<MigrationException> getError() {
        return Optional.ofNullable(error);
    }
}
