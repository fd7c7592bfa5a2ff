package io.github.yok.dbbridge.migration;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-table record of committed rows.
 *
 * <p>
 * For each table the cursor holds the <em>committed offset</em>: every row before it is committed
 * on the target. Batches committed out of order by concurrent workers are kept as
 * <em>committed ranges</em> beyond the offset and folded into it once the gap before them closes.
 * The cursor only moves when {@link #markCommitted(String, RowRange)} is called, which the runner
 * does after a target commit succeeded.
 * </p>
 *
 * <p>
 * Thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MigrationCursor {

    private final Map<String, Progress> tables = new LinkedHashMap<>();

    /**
     * Creates an empty cursor: every table starts at offset 0.
     */
    public MigrationCursor() {}

    /**
     * Creates a cursor from committed offsets.
     *
     * @param offsets table name to committed offset
     * @return new cursor
     */
    public static MigrationCursor ofOffsets(Map<String, Long> offsets) {
        MigrationCursor cursor = new MigrationCursor();
        offsets.forEach((table, offset) -> cursor.restore(table, offset, ImmutableList.of()));
        return cursor;
    }

    /**
     * Restores the state of a table, replacing any existing record.
     *
     * @param table table name
     * @param committedOffset committed offset
     * @param committedRanges ranges committed beyond the offset
     */
    public synchronized void restore(String table, long committedOffset,
            List<RowRange> committedRanges) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkArgument(committedOffset >= 0, "committedOffset must not be negative");
        Progress progress = new Progress();
        progress.offset = committedOffset;
        for (RowRange range : committedRanges) {
            progress.add(range);
        }
        tables.put(table, progress);
    }

    /**
     * Returns the committed offset of a table.
     *
     * @param table table name
     * @return offset before which every row is committed, {@code 0} for unknown tables
     */
    public synchronized long committedOffset(String table) {
        Progress progress = tables.get(table);
        return progress == null ? 0L : progress.offset;
    }

    /**
     * Returns the ranges committed beyond the committed offset.
     *
     * @param table table name
     * @return ranges in ascending order, empty for sequential runs
     */
    public synchronized List<RowRange> committedRanges(String table) {
        Progress progress = tables.get(table);
        if (progress == null) {
            return ImmutableList.of();
        }
        List<RowRange> ranges = new ArrayList<>();
        progress.ahead.forEach((start, end) -> ranges.add(new RowRange(start, end)));
        return ImmutableList.copyOf(ranges);
    }

    /**
     * Records a committed batch.
     *
     * @param table table name
     * @param range rows committed by the batch
     */
    public synchronized void markCommitted(String table, RowRange range) {
        Preconditions.checkNotNull(range, "range must not be null");
        tables.computeIfAbsent(table, t -> new Progress()).add(range);
    }

    /**
     * Plans the batches that remain for a table.
     *
     * <p>
     * Starts at the committed offset, skips committed ranges, and cuts the rest into ranges of at
     * most {@code batchSize} rows that never straddle a committed range.
     * </p>
     *
     * @param table table name
     * @param totalRows current row count of the source table
     * @param batchSize maximum rows per batch
     * @return ranges to transfer, in order
     */
    public synchronized List<RowRange> plan(String table, long totalRows, int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive");
        Progress progress = tables.get(table);
        long position = progress == null ? 0L : progress.offset;
        TreeMap<Long, Long> ahead = progress == null ? new TreeMap<>() : progress.ahead;

        List<RowRange> planned = new ArrayList<>();
        while (position < totalRows) {
            Long skipTo = ahead.get(position);
            if (skipTo != null) {
                position = skipTo;
                continue;
            }
            Long nextCommitted = ahead.higherKey(position);
            long limit = Math.min(position + batchSize, totalRows);
            if (nextCommitted != null) {
                limit = Math.min(limit, nextCommitted);
            }
            planned.add(new RowRange(position, limit));
            position = limit;
        }
        return planned;
    }

    /**
     * Returns the committed offsets of every known table.
     *
     * @return table name to offset, in first-seen order
     */
    public synchronized Map<String, Long> offsets() {
        ImmutableMap.Builder<String, Long> builder = ImmutableMap.builder();
        tables.forEach((table, progress) -> builder.put(table, progress.offset));
        return builder.build();
    }

    /**
     * Returns an independent copy.
     *
     * @return snapshot of this cursor
     */
    public synchronized MigrationCursor copy() {
        MigrationCursor copy = new MigrationCursor();
        tables.forEach((table, progress) -> copy.restore(table, progress.offset,
                committedRanges(table)));
        return copy;
    }

    @Override
    public synchronized String toString() {
        return "MigrationCursor" + offsets();
    }

    /**
     * Progress of one table.
     */
    private static final class Progress {

        private long offset;

        // start -> end of committed ranges beyond offset
        private final TreeMap<Long, Long> ahead = new TreeMap<>();

        void add(RowRange range) {
            if (range.getEnd() <= offset) {
                return;
            }
            if (range.getStart() <= offset) {
                offset = range.getEnd();
            } else {
                ahead.merge(range.getStart(), range.getEnd(), Math::max);
            }
            // Fold ranges the offset has reached
            Map.Entry<Long, Long> first = ahead.firstEntry();
            while (first != null && first.getKey() <= offset) {
                offset = Math.max(offset, first.getValue());
                ahead.pollFirstEntry();
                first = ahead.firstEntry();
            }
        }
    }
}
