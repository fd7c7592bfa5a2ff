package io.github.yok.dbbridge.cli;

import io.github.yok.dbbridge.migration.MigrationResult;
import io.github.yok.dbbridge.migration.TableResult;
import java.io.PrintStream;
import java.util.stream.Collectors;

/**
 * Prints the per-table outcome of a migration run.
 *
 * <pre>
 * TABLE            STATE      ROWS       OFFSET
 * users            COMPLETED  1200       1200
 * orders           FAILED     500        500
 * order_items      SKIPPED    0          0
 * state=PARTIALLY_COMPLETED rows=1700
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public class MigrationSummaryPrinter {

    private static final int MIN_TABLE_WIDTH = 16;

    /**
     * Writes the summary.
     *
     * @param result migration outcome
     * @param out destination
     */
    public void print(MigrationResult result, PrintStream out) {
        int width = Math.max(MIN_TABLE_WIDTH, result.getTables().keySet().stream()
                .mapToInt(String::length).max().orElse(0));
        String format = "%-" + width + "s %-19s %12s %12s%n";
        out.printf(format, "TABLE", "STATE", "ROWS", "OFFSET");
        for (TableResult table : result.getTables().values()) {
            out.printf(format, table.getTable(), table.getState(), table.getRowsTransferred(),
                    offset(table));
        }
        out.printf("state=%s rows=%d%n", result.getState(), result.getRowsTransferred());
        result.getError().ifPresent(e -> out.println("error: " + e.getMessage()));
    }

    private static String offset(TableResult table) {
        if (table.getCommittedRanges().isEmpty()) {
            return String.valueOf(table.getCommittedOffset());
        }
        // Ranges committed beyond the offset by concurrent workers
        return table.getCommittedOffset() + " +" + table.getCommittedRanges().stream()
                .map(Object::toString).collect(Collectors.joining(""));
    }
}
