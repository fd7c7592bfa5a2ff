package io.github.yok.dbbridge.migration;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.dbbridge.db.DbTransaction;
import io.github.yok.dbbridge.error.MigrationException;
import java.time.Duration;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Copies table rows from a source driver to a target driver in batches.
 *
 * <p>
 * Each batch is read from the source with {@code LIMIT/OFFSET} in a stable order, inserted into
 * the target in a single transaction and committed; the job's {@link MigrationCursor} advances only
 * after the commit. A failed attempt is retried up to {@link MigrationJob#getMaxAttempts()} times.
 * Every attempt is bounded by {@link MigrationJob#getAttemptTimeout()}: a watchdog cancels the
 * attempt's transaction, which can then never commit. A commit already in progress when the
 * deadline passes is left to finish.
 * </p>
 *
 * <p>
 * Tables run one after another. With more than one worker and a target that accepts concurrent
 * writers, the batches of a table run in windows of {@code workers} batches; batches committed
 * beyond a failed one are kept in the cursor as committed ranges.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class MigrationRunner {

    private static final Pattern TABLE_NAME =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Pattern COLUMN_POSITION = Pattern.compile("[1-9][0-9]*");

    /**
     * Runs a job to completion or to its first unrecoverable failure.
     *
     * <p>
     * Failures are reported in the result, not thrown. If the calling thread is interrupted the run
     * stops after the in-flight batch, ends {@link MigrationState#FAILED}, and the interrupt flag
     * stays set.
     * </p>
     *
     * @param job job to run
     * @return outcome with per-table results and a cursor snapshot
     * @throws IllegalArgumentException if the job is invalid
     */
    public MigrationResult run(MigrationJob job) {
        validate(job);

        Map<String, TableResult> results = new LinkedHashMap<>();
        for (String table : job.getTables()) {
            results.put(table, TableResult.builder().table(table).state(TableState.PENDING)
                    .committedOffset(job.getCursor().committedOffset(table)).build());
        }
        log.info("Migration {} → {} (tables={}, batchSize={}, maxAttempts={}, timeout={})",
                job.getSource().dialect(), job.getTarget().dialect(), job.getTables(),
                job.getBatchSize(), job.getMaxAttempts(), job.getAttemptTimeout());

        int workers = job.getWorkers();
        if (workers > 1 && !job.getTarget().supportsConcurrentWriters()) {
            log.info("Target {} allows a single writer → workers={} reduced to 1",
                    job.getTarget().dialect(), workers);
            workers = 1;
        }

        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("dbbridge-watchdog-%d").setDaemon(true)
                        .build());
        ExecutorService pool = workers > 1
                ? Executors.newFixedThreadPool(workers,
                        new ThreadFactoryBuilder().setNameFormat("dbbridge-worker-%d")
                                .setDaemon(true).build())
                : null;

        MigrationState state = MigrationState.RUNNING;
        MigrationException error = null;
        try {
            for (String table : job.getTables()) {
                if (error != null) {
                    results.put(table,
                            results.get(table).toBuilder().state(TableState.SKIPPED).build());
                    log.info("[{}] Skipped: an earlier table failed", table);
                    continue;
                }
                TableRun run = new TableRun(job, table, watchdog, pool, workers);
                try {
                    results.put(table, run.execute());
                } catch (BatchExhaustedException e) {
                    error = e.getFailure();
                    state = MigrationState.PARTIALLY_COMPLETED;
                    results.put(table, run.failed(error));
                    log.error("[{}] Failed: {}", table, error.getMessage(), error.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    error = new MigrationException(table, job.getCursor().committedOffset(table),
                            "Migration interrupted", e);
                    state = MigrationState.FAILED;
                    results.put(table, run.failed(error));
                    log.error("[{}] Interrupted at committed offset {}", table,
                            error.getCommittedOffset());
                } catch (RuntimeException e) {
                    error = new MigrationException(table, job.getCursor().committedOffset(table),
                            "Table could not be migrated: " + e.getMessage(), e);
                    state = MigrationState.FAILED;
                    results.put(table, run.failed(error));
                    log.error("[{}] Failed outside batch scope", table, e);
                }
            }
        } finally {
            if (pool != null) {
                shutdownAndAwait(pool, job.getAttemptTimeout());
            }
            watchdog.shutdownNow();
        }
        if (error == null) {
            state = MigrationState.COMPLETED;
        }

        // Refresh offsets: workers may have committed after a table result was built
        Map<String, TableResult> finalResults = new LinkedHashMap<>();
        results.forEach((table, result) -> finalResults.put(table,
                withCursor(result, job.getCursor(), table)));
        MigrationResult result =
                new MigrationResult(state, finalResults, job.getCursor().copy(), error);
        log.info("Migration finished: state={}, rows={}", state, result.getRowsTransferred());
        return result;
    }

    private static TableResult withCursor(TableResult result, MigrationCursor cursor,
            String table) {
        return result.toBuilder().committedOffset(cursor.committedOffset(table))
                .committedRanges(cursor.committedRanges(table)).build();
    }

    /**
     * Rejects jobs the runner cannot execute.
     *
     * @param job job to check
     * @throws IllegalArgumentException on an invalid setting or table name
     */
    static void validate(MigrationJob job) {
        Preconditions.checkArgument(job.getBatchSize() > 0, "batchSize must be positive: %s",
                job.getBatchSize());
        Preconditions.checkArgument(job.getMaxAttempts() > 0, "maxAttempts must be positive: %s",
                job.getMaxAttempts());
        Preconditions.checkArgument(job.getWorkers() > 0, "workers must be positive: %s",
                job.getWorkers());
        Preconditions.checkArgument(
                job.getAttemptTimeout() != null && !job.getAttemptTimeout().isNegative()
                        && !job.getAttemptTimeout().isZero(),
                "attemptTimeout must be positive: %s", job.getAttemptTimeout());
        Preconditions.checkArgument(
                job.getRetryBackoff() != null && !job.getRetryBackoff().isNegative(),
                "retryBackoff must not be negative: %s", job.getRetryBackoff());
        Preconditions.checkArgument(job.getCursor() != null, "cursor must not be null");
        Preconditions.checkArgument(job.getCommitListener() != null,
                "commitListener must not be null");
        for (String table : job.getTables()) {
            Preconditions.checkArgument(table != null && TABLE_NAME.matcher(table).matches(),
                    "Invalid table name: %s", table);
        }
        Preconditions.checkArgument(
                job.getTables().stream().distinct().count() == job.getTables().size(),
                "Duplicate table in %s", job.getTables());
        job.getOrderColumns().forEach((table, column) -> Preconditions.checkArgument(
                column != null && (SIMPLE_IDENTIFIER.matcher(column).matches()
                        || COLUMN_POSITION.matcher(column).matches()),
                "Invalid order column for %s: %s", table, column));
    }

    /**
     * Renders a column name for an INSERT column list.
     *
     * @param column column label reported by the source
     * @return the name as is when it is a plain identifier, otherwise double-quoted
     */
    static String quoteColumn(String column) {
        if (SIMPLE_IDENTIFIER.matcher(column).matches()) {
            return column;
        }
        return '"' + StringUtils.replace(column, "\"", "\"\"") + '"';
    }

    /**
     * Builds the INSERT statement for a batch.
     *
     * @param table target table
     * @param columns column labels in source order
     * @return parameterised INSERT
     */
    static String insertSql(String table, List<String> columns) {
        String columnList = columns.stream().map(MigrationRunner::quoteColumn)
                .collect(Collectors.joining(", "));
        String values = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + columnList + ") VALUES (" + values + ")";
    }

    /**
     * Converts a source value into one every target driver can bind.
     *
     * @param value JDBC value from the source
     * @return the value itself for common JDBC types, its text form otherwise
     */
    static Object portableValue(Object value) {
        if (value == null || value instanceof Number || value instanceof String
                || value instanceof Boolean || value instanceof byte[]
                || value instanceof java.util.Date || value instanceof Temporal) {
            return value;
        }
        return value.toString();
    }

    private static void shutdownAndAwait(ExecutorService pool, Duration grace) {
        pool.shutdownNow();
        boolean interrupted = Thread.interrupted();
        try {
            // In-flight attempts are bounded by the attempt timeout
            if (!pool.awaitTermination(grace.toMillis() + 5_000L, TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not terminate within {}", grace);
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Transfer of one table.
     */
    private static final class TableRun {

        private final MigrationJob job;

        private final String table;

        private final ScheduledExecutorService watchdog;

        private final ExecutorService pool;

        private final int workers;

        private final AtomicLong rows = new AtomicLong();

        private final AtomicInteger batches = new AtomicInteger();

        private long totalRows = -1L;

        TableRun(MigrationJob job, String table, ScheduledExecutorService watchdog,
                ExecutorService pool, int workers) {
            this.job = job;
            this.table = table;
            this.watchdog = watchdog;
            this.pool = pool;
            this.workers = workers;
        }

        TableResult execute() throws InterruptedException, BatchExhaustedException {
            MigrationCursor cursor = job.getCursor();
            totalRows = countRows();
            List<RowRange> plan = cursor.plan(table, totalRows, job.getBatchSize());
            log.info("[{}] Started: rows={}, committedOffset={}, batches={}", table, totalRows,
                    cursor.committedOffset(table), plan.size());
            if (cursor.committedOffset(table) > totalRows) {
                log.warn("[{}] Committed offset {} is beyond the source row count {}", table,
                        cursor.committedOffset(table), totalRows);
            }

            if (pool == null) {
                for (RowRange range : plan) {
                    transferWithRetry(range);
                }
            } else {
                for (int i = 0; i < plan.size(); i += workers) {
                    runWindow(plan.subList(i, Math.min(i + workers, plan.size())));
                }
            }
            log.info("[{}] Completed: rows={}, batches={}", table, rows.get(), batches.get());
            return result(TableState.COMPLETED, null);
        }

        TableResult failed(MigrationException error) {
            return result(TableState.FAILED, error);
        }

        private TableResult result(TableState state, MigrationException error) {
            return TableResult.builder().table(table).state(state).totalRows(totalRows)
                    .rowsTransferred(rows.get()).batchesCommitted(batches.get())
                    .committedOffset(job.getCursor().committedOffset(table))
                    .committedRanges(job.getCursor().committedRanges(table)).error(error).build();
        }

        private long countRows() {
            List<Long> counts = job.getSource().queryMany("SELECT COUNT(*) FROM " + table,
                    (rs, rowNum) -> rs.getLong(1));
            return counts.isEmpty() ? 0L : counts.get(0);
        }

        private void runWindow(List<RowRange> window)
                throws InterruptedException, BatchExhaustedException {
            List<Future<Void>> futures = new ArrayList<>();
            for (RowRange range : window) {
                futures.add(pool.submit(() -> {
                    transferWithRetry(range);
                    return null;
                }));
            }
            BatchExhaustedException firstFailure = null;
            InterruptedException interruption = null;
            for (Future<Void> future : futures) {
                try {
                    future.get();
                } catch (InterruptedException e) {
                    futures.forEach(f -> f.cancel(true));
                    throw e;
                } catch (CancellationException e) {
                    interruption = new InterruptedException("Batch cancelled");
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof BatchExhaustedException && firstFailure == null) {
                        firstFailure = (BatchExhaustedException) cause;
                    } else if (cause instanceof InterruptedException) {
                        interruption = (InterruptedException) cause;
                    } else if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    } else if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                }
            }
            if (interruption != null) {
                throw interruption;
            }
            if (firstFailure != null) {
                // Report the offset after the whole window settled
                MigrationException failure = firstFailure.getFailure();
                throw new BatchExhaustedException(new MigrationException(table,
                        job.getCursor().committedOffset(table), firstFailure.getDetail(),
                        failure.getCause()));
            }
        }

        private void transferWithRetry(RowRange range)
                throws InterruptedException, BatchExhaustedException {
            Exception last = null;
            int maxAttempts = job.getMaxAttempts();
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Interrupted before batch " + range);
                }
                try {
                    long transferred = attempt(range);
                    committed(range, transferred);
                    return;
                } catch (AttemptTimeoutException | RuntimeException e) {
                    last = e;
                    if (Thread.currentThread().isInterrupted()) {
                        throw new InterruptedException("Interrupted during batch " + range);
                    }
                    log.warn("[{}] Batch {} attempt {}/{} failed: {}", table, range, attempt,
                            maxAttempts, e.getMessage());
                    if (attempt < maxAttempts && !job.getRetryBackoff().isZero()) {
                        Thread.sleep(job.getRetryBackoff().toMillis());
                    }
                }
            }
            String detail = "Batch " + range + " failed after " + maxAttempts + " attempt(s)";
            throw new BatchExhaustedException(new MigrationException(table,
                    job.getCursor().committedOffset(table), detail, last), detail);
        }

        private void committed(RowRange range, long transferred) {
            MigrationCursor cursor = job.getCursor();
            cursor.markCommitted(table, range);
            rows.addAndGet(transferred);
            batches.incrementAndGet();
            if (transferred < range.size()) {
                log.warn("[{}] Batch {} returned {} row(s); the source shrank", table, range,
                        transferred);
            }
            log.debug("[{}] Batch {} committed ({} rows), committedOffset={}", table, range,
                    transferred, cursor.committedOffset(table));
            try {
                job.getCommitListener().onCommitted(table, range, cursor);
            } catch (RuntimeException e) {
                log.error("[{}] Commit listener failed for batch {}", table, range, e);
            }
        }

        /**
         * Runs one attempt: read, insert, commit.
         *
         * @return rows committed
         */
        private long attempt(RowRange range) throws AttemptTimeoutException {
            Duration timeout = job.getAttemptTimeout();
            AttemptGuard guard = new AttemptGuard(Thread.currentThread(), timeout);
            ScheduledFuture<?> timer =
                    watchdog.schedule(guard::expire, timeout.toNanos(), TimeUnit.NANOSECONDS);
            try {
                List<Map<String, Object>> rows;
                try (DbTransaction read = job.getSource().beginTransaction(timeout)) {
                    guard.register(read);
                    rows = read.queryMany("SELECT * FROM " + table + " ORDER BY "
                            + job.orderColumnFor(table) + " LIMIT ? OFFSET ?", range.size(),
                            range.getStart());
                }
                guard.checkNotExpired(range);
                if (rows.isEmpty()) {
                    return 0L;
                }
                List<String> columns = new ArrayList<>(rows.get(0).keySet());
                List<Object[]> batch = new ArrayList<>(rows.size());
                for (Map<String, Object> row : rows) {
                    batch.add(row.values().stream().map(MigrationRunner::portableValue).toArray());
                }
                try (DbTransaction write = job.getTarget().beginTransaction(guard.remaining())) {
                    guard.register(write);
                    write.executeBatch(insertSql(table, columns), batch);
                    write.commit();
                }
                return batch.size();
            } catch (RuntimeException e) {
                if (guard.isExpired()) {
                    throw new AttemptTimeoutException(
                            "Attempt for batch " + range + " timed out after " + timeout, e);
                }
                throw e;
            } finally {
                timer.cancel(false);
                guard.finish();
            }
        }
    }

    /**
     * Coordinates an attempt with its watchdog.
     *
     * <p>
     * Expiry cancels the registered transaction and interrupts the attempt thread. If the
     * transaction refuses the cancel because its commit already started, expiry is a no-op and
     * the commit's outcome stands.
     * </p>
     */
    private static final class AttemptGuard {

        private final Thread worker;

        private final long deadline;

        private DbTransaction transaction;

        private boolean expired;

        private boolean finished;

        AttemptGuard(Thread worker, Duration timeout) {
            this.worker = worker;
            this.deadline = System.nanoTime() + timeout.toNanos();
        }

        // Time left before the watchdog fires; at least 1ms so the transaction stays bounded
        Duration remaining() {
            return Duration.ofNanos(Math.max(TimeUnit.MILLISECONDS.toNanos(1),
                    deadline - System.nanoTime()));
        }

        synchronized void register(DbTransaction tx) {
            this.transaction = tx;
            if (expired) {
                tx.cancel();
            }
        }

        synchronized void expire() {
            if (finished) {
                return;
            }
            if (transaction != null && !transaction.cancel()) {
                log.debug("Attempt deadline passed during commit → letting it finish");
                return;
            }
            expired = true;
            worker.interrupt();
        }

        synchronized boolean isExpired() {
            return expired;
        }

        synchronized void checkNotExpired(RowRange range) throws AttemptTimeoutException {
            if (expired) {
                throw new AttemptTimeoutException("Attempt for batch " + range + " timed out");
            }
        }

        void finish() {
            boolean clearInterrupt;
            synchronized (this) {
                finished = true;
                clearInterrupt = expired;
            }
            if (clearInterrupt) {
                // Drop the watchdog's interrupt so the retry loop does not read it as a stop
                Thread.interrupted();
            }
        }
    }

    /**
     * An attempt ran past its deadline.
     */
    static final class AttemptTimeoutException extends Exception {

        private static final long serialVersionUID = 1L;

        AttemptTimeoutException(String message) {
            super(message);
        }

        AttemptTimeoutException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A batch used up its attempts.
     */
    static final class BatchExhaustedException extends Exception {

        private static final long serialVersionUID = 1L;

        private final transient MigrationException failure;

        private final String detail;

        BatchExhaustedException(MigrationException failure, String detail) {
            super(failure.getMessage(), failure);
            this.failure = failure;
            this.detail = detail;
        }

        BatchExhaustedException(MigrationException failure) {
            this(failure, failure.getMessage());
        }

        MigrationException getFailure() {
            return failure;
        }

        String getDetail() {
            return detail;
        }
    }
}
