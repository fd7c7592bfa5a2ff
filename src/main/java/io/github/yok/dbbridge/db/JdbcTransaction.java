package io.github.yok.dbbridge.db;

import com.google.common.base.Preconditions;
import io.github.yok.dbbridge.error.QueryException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link DbTransaction} over a pooled JDBC connection with auto-commit disabled.
 *
 * <p>
 * The status only moves forward. {@link #commit()} and {@link #cancel()} race through a single
 * compare-and-set on {@code ACTIVE}, so exactly one of them wins: a cancelled transaction never
 * commits, and a commit that has begun is never reported as cancelled.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
final class JdbcTransaction implements DbTransaction, AbstractDbDriver.StatementTracker {

    private enum Status {
        ACTIVE, COMMITTING, COMMITTED, CANCELLED, FAILED, ROLLED_BACK
    }

    private final AbstractDbDriver driver;

    private final Connection connection;

    // System.nanoTime() deadline, 0 when unbounded
    private final long deadlineNanos;

    private final AtomicReference<Status> status = new AtomicReference<>(Status.ACTIVE);

    private volatile Statement running;

    private boolean closed;

    /**
     * Wraps a connection whose auto-commit is already disabled.
     *
     * @param driver owning driver
     * @param connection dedicated connection
     * @param timeout overall bound, {@code null} or zero for none
     */
    JdbcTransaction(AbstractDbDriver driver, Connection connection, Duration timeout) {
        this.driver = driver;
        this.connection = connection;
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            this.deadlineNanos = 0L;
        } else {
            this.deadlineNanos = System.nanoTime() + timeout.toNanos();
        }
    }

    @Override
    public ExecResult execute(String sql, Object... args) {
        Preconditions.checkNotNull(sql, "sql must not be null");
        int timeoutSeconds = checkUsable();
        try {
            return driver.executeOn(connection, sql, args, timeoutSeconds, this);
        } catch (SQLException e) {
            throw new QueryException("Statement failed: " + JdbcSupport.abbreviate(sql), e);
        }
    }

    @Override
    public long executeBatch(String sql, List<Object[]> rows) {
        Preconditions.checkNotNull(sql, "sql must not be null");
        Preconditions.checkNotNull(rows, "rows must not be null");
        int timeoutSeconds = checkUsable();
        if (rows.isEmpty()) {
            return 0L;
        }
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            track(ps);
            try {
                if (timeoutSeconds > 0) {
                    ps.setQueryTimeout(timeoutSeconds);
                }
                for (Object[] row : rows) {
                    JdbcSupport.bind(ps, row);
                    ps.addBatch();
                }
                long total = 0L;
                for (int count : ps.executeBatch()) {
                    // SUCCESS_NO_INFO (-2) counts as one row
                    total += count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(0, count);
                }
                log.debug("[{}] Batch executed: {} (rows={}, affected={})", driver.dialect(),
                        JdbcSupport.abbreviate(sql), rows.size(), total);
                return total;
            } finally {
                untrack();
            }
        } catch (SQLException e) {
            throw new QueryException("Batch failed: " + JdbcSupport.abbreviate(sql), e);
        }
    }

    @Override
    public List<Map<String, Object>> queryMany(String sql, Object... args) {
        Preconditions.checkNotNull(sql, "sql must not be null");
        int timeoutSeconds = checkUsable();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            track(ps);
            try {
                if (timeoutSeconds > 0) {
                    ps.setQueryTimeout(timeoutSeconds);
                }
                JdbcSupport.bind(ps, args);
                try (ResultSet rs = ps.executeQuery()) {
                    return JdbcSupport.mapRows(rs, JdbcSupport::toMap);
                }
            } finally {
                untrack();
            }
        } catch (SQLException e) {
            throw new QueryException("Query failed: " + JdbcSupport.abbreviate(sql), e);
        }
    }

    @Override
    public void commit() {
        if (!status.compareAndSet(Status.ACTIVE, Status.COMMITTING)) {
            throw new QueryException(
                    "[" + driver.dialect() + "] cannot commit a " + status.get() + " transaction");
        }
        try {
            connection.commit();
            status.set(Status.COMMITTED);
        } catch (SQLException e) {
            status.set(Status.FAILED);
            rollbackAfterFailure();
            throw new QueryException("[" + driver.dialect() + "] commit failed", e);
        }
    }

    @Override
    public void rollback() {
        Status current = status.get();
        if (current == Status.COMMITTED || current == Status.ROLLED_BACK) {
            return;
        }
        if (current == Status.COMMITTING) {
            throw new QueryException("[" + driver.dialect() + "] commit in progress");
        }
        try {
            connection.rollback();
            status.set(Status.ROLLED_BACK);
        } catch (SQLException e) {
            throw new QueryException("[" + driver.dialect() + "] rollback failed", e);
        }
    }

    @Override
    public boolean cancel() {
        if (!status.compareAndSet(Status.ACTIVE, Status.CANCELLED)) {
            Status current = status.get();
            return current != Status.COMMITTING && current != Status.COMMITTED;
        }
        Statement statement = running;
        if (statement != null) {
            try {
                statement.cancel();
            } catch (SQLException e) {
                log.warn("[{}] Failed to cancel running statement: {}", driver.dialect(),
                        e.getMessage(), e);
            }
        }
        log.debug("[{}] Transaction cancelled", driver.dialect());
        return true;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Status current = status.get();
        if (current != Status.COMMITTED && current != Status.ROLLED_BACK) {
            rollbackAfterFailure();
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[{}] Failed to release transaction connection: {}", driver.dialect(),
                    e.getMessage(), e);
        }
    }

    @Override
    public void track(Statement statement) {
        running = statement;
    }

    @Override
    public void untrack() {
        running = null;
    }

    /**
     * Verifies the transaction accepts statements and returns the JDBC timeout to apply.
     *
     * @return query timeout in seconds, {@code 0} when unbounded
     */
    private int checkUsable() {
        Status current = status.get();
        if (current != Status.ACTIVE) {
            throw new QueryException("[" + driver.dialect() + "] transaction is "
                    + current.name().toLowerCase(Locale.ROOT));
        }
        if (deadlineNanos == 0L) {
            return 0;
        }
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0L) {
            throw new QueryException("[" + driver.dialect() + "] transaction deadline exceeded");
        }
        // JDBC timeouts are whole seconds; round up so a short remainder still bounds the call
        return (int) Math.max(1L, (TimeUnit.NANOSECONDS.toMillis(remaining) + 999L) / 1000L);
    }

    private void rollbackAfterFailure() {
        try {
            connection.rollback();
            status.compareAndSet(Status.ACTIVE, Status.ROLLED_BACK);
        } catch (SQLException e) {
            log.warn("[{}] Rollback failed: {}", driver.dialect(), e.getMessage(), e);
        }
    }
}
