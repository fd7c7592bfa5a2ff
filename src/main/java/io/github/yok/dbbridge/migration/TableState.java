package io.github.yok.dbbridge.migration;

/**
 * Terminal state of one table within a migration run.
 *
 * @author Yasuharu.Okawauchi
 */
public enum TableState {
    // Not started
    PENDING,
    // Being transferred
    RUNNING,
    // All rows up to the counted total are committed
    COMPLETED,
    // Stopped on a failure; see the committed offset
    FAILED,
    // Not attempted because an earlier table failed
    SKIPPED
}
