package io.github.yok.dbbridge.migration;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * Half-open row interval {@code [start, end)} of a table in migration order.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RowRange {

    long start;

    long end;

    /**
     * Creates a range.
     *
     * @param start first row offset, inclusive
     * @param end last row offset, exclusive
     * @throws IllegalArgumentException if {@code start < 0} or {@code end < start}
     */
    public RowRange(long start, long end) {
        Preconditions.checkArgument(start >= 0, "start must not be negative: %s", start);
        Preconditions.checkArgument(end >= start, "end must not be before start: [%s, %s)", start,
                end);
        this.start = start;
        this.end = end;
    }

    /**
     * Returns the number of rows in the range.
     *
     * @return {@code end - start}
     */
    public long size() {
        return end - start;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
