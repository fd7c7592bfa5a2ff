package io.github.yok.dbbridge.migration;

import io.github.yok.dbbridge.db.DbDriver;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Description of one migration run from a source driver to a target driver.
 *
 * <p>
 * Tables are transferred in list order; ordering parents before children is the caller's job. The
 * {@link MigrationCursor} is the only mutable part: the runner advances it as batches commit, so
 * running the same job again resumes where the previous run stopped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class MigrationJob {

    /** Default rows per batch. */
    public static final int DEFAULT_BATCH_SIZE = 500;

    /** Default attempts per batch. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    @NonNull
    DbDriver source;

    @NonNull
    DbDriver target;

    @Singular
    List<String> tables;

    @Builder.Default
    int batchSize = DEFAULT_BATCH_SIZE;

    // Bound on one attempt: read, insert and commit
    @Builder.Default
    Duration attemptTimeout = Duration.ofSeconds(30);

    // Total attempts per batch, the first one included
    @Builder.Default
    int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    @Builder.Default
    Duration retryBackoff = Duration.ofMillis(500);

    @Builder.Default
    int workers = 1;

    // Table name to ORDER BY column; tables without an entry are ordered by their first column
    @Singular
    Map<String, String> orderColumns;

    @Builder.Default
    MigrationCursor cursor = new MigrationCursor();

    @Builder.Default
    BatchCommitListener commitListener = BatchCommitListener.NONE;

    /**
     * Returns the ORDER BY expression for a table.
     *
     * @param table table name
     * @return configured column, or {@code 1} for the first column
     */
    public String orderColumnFor(String table) {
        return orderColumns.getOrDefault(table, "1");
    }
}
