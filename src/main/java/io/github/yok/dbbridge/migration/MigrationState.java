package io.github.yok.dbbridge.migration;

/**
 * Lifecycle of a migration job.
 *
 * <pre>
 * PENDING → RUNNING → { COMPLETED, FAILED, PARTIALLY_COMPLETED }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public enum MigrationState {
    // Created, not started
    PENDING,
    // Tables are being transferred
    RUNNING,
    // Every table transferred
    COMPLETED,
    // Stopped outside batch scope (interrupted, source unreadable); cursor is still valid
    FAILED,
    // A batch exhausted its attempts; resumable from the recorded offsets
    PARTIALLY_COMPLETED
}
