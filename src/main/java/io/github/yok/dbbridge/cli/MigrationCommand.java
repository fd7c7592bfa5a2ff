package io.github.yok.dbbridge.cli;

import io.github.yok.dbbridge.config.DatabaseConfig;
import io.github.yok.dbbridge.config.DbConfig;
import io.github.yok.dbbridge.db.DbDriver;
import io.github.yok.dbbridge.db.DbDriverFactory;
import io.github.yok.dbbridge.migration.BatchCommitListener;
import io.github.yok.dbbridge.migration.MigrationCheckpointStore;
import io.github.yok.dbbridge.migration.MigrationCursor;
import io.github.yok.dbbridge.migration.MigrationJob;
import io.github.yok.dbbridge.migration.MigrationResult;
import io.github.yok.dbbridge.migration.MigrationRunner;
import io.github.yok.dbbridge.util.ErrorHandler;
import io.github.yok.dbbridge.util.TableDependencyResolver;
import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs one migration from the command line and maps its outcome to an exit code.
 *
 * <ul>
 * <li>{@code 0}: every table migrated ({@code --help} included).</li>
 * <li>{@code 1}: the migration did not complete, or an unrecoverable error occurred.</li>
 * <li>{@code 2}: invalid arguments or connection settings.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationCommand {

    /** Exit code of a completed migration. */
    public static final int EXIT_OK = 0;

    private final DatabaseConfig databaseConfig;
    private final DbDriverFactory driverFactory;
    private final MigrationRunner runner;
    private final MigrationOptionsParser parser = new MigrationOptionsParser();
    private final MigrationSummaryPrinter printer = new MigrationSummaryPrinter();

    /**
     * Parses the arguments and runs the migration, printing the summary to {@code System.out}.
     *
     * @param args command-line arguments
     * @return process exit code
     */
    public int execute(String... args) {
        return execute(System.out, args);
    }

    /**
     * Parses the arguments and runs the migration.
     *
     * @param out destination of the summary
     * @param args command-line arguments
     * @return process exit code
     */
    public int execute(PrintStream out, String... args) {
        MigrationOptions options;
        DbConfig sourceConfig;
        DbConfig targetConfig;
        try {
            options = parser.parse(args);
            if (options.isHelp()) {
                out.println(MigrationOptionsParser.USAGE);
                return EXIT_OK;
            }
            sourceConfig = options.getSource().applyTo(databaseConfig.getSource());
            targetConfig = options.getTarget().applyTo(databaseConfig.getTarget());
        } catch (IllegalArgumentException | NullPointerException e) {
            return ErrorHandler.usage(e.getMessage(), MigrationOptionsParser.USAGE);
        }
        log.info("Options: {}", options);

        try (DbDriver source = driverFactory.connect(sourceConfig);
                DbDriver target = driverFactory.connect(targetConfig)) {
            if (options.isInitSchema()) {
                target.initializeSchema();
            }
            List<String> tables = options.getTables().isEmpty()
                    ? TableDependencyResolver.resolveOrder(source, source.listTables())
                    : options.getTables();

            MigrationCheckpointStore store = options.getCheckpoint() == null ? null
                    : new MigrationCheckpointStore(options.getCheckpoint());
            MigrationJob job = buildJob(options, source, target, tables, store);
            MigrationResult result = runner.run(job);
            if (store != null) {
                store.save(result.cursor());
            }
            printer.print(result, out);
            return result.isCompleted() ? EXIT_OK : ErrorHandler.EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            return ErrorHandler.usage(e.getMessage(), MigrationOptionsParser.USAGE);
        } catch (RuntimeException e) {
            return ErrorHandler.fatal("Migration aborted", e);
        }
    }

    private MigrationJob buildJob(MigrationOptions options, DbDriver source, DbDriver target,
            List<String> tables, MigrationCheckpointStore store) {
        DatabaseConfig.MigrationProperties settings = databaseConfig.getMigration();
        MigrationCursor cursor = store == null ? new MigrationCursor() : store.load();
        BatchCommitListener listener =
                store == null ? BatchCommitListener.NONE : store.asListener();
        return MigrationJob.builder()
                .source(source)
                .target(target)
                .tables(tables)
                .batchSize(options.effectiveBatchSize(settings))
                .attemptTimeout(Duration.ofSeconds(options.effectiveTimeoutSeconds(settings)))
                .maxAttempts(options.effectiveRetries(settings))
                .retryBackoff(settings.getRetryBackoff())
                .workers(options.effectiveWorkers(settings))
                .cursor(cursor)
                .commitListener(listener)
                .build();
    }
}
