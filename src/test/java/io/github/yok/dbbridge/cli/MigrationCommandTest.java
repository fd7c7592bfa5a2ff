package io.github.yok.dbbridge.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mockStatic;
import io.github.yok.dbbridge.config.DatabaseConfig;
import io.github.yok.dbbridge.config.DbConfig;
import io.github.yok.dbbridge.db.DbDriver;
import io.github.yok.dbbridge.db.DbDriverFactory;
import io.github.yok.dbbridge.db.DbTransaction;
import io.github.yok.dbbridge.migration.MigrationCheckpointStore;
import io.github.yok.dbbridge.migration.MigrationRunner;
import io.github.yok.dbbridge.schema.SchemaManager;
import io.github.yok.dbbridge.util.ErrorHandler;
import io.github.yok.dbbridge.util.TableDependencyResolver;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.MockedStatic;

class MigrationCommandTest {

    @TempDir
    Path tempDir;

    private final DbDriverFactory factory = new DbDriverFactory(new SchemaManager());

    private DatabaseConfig databaseConfig;

    private MigrationCommand command;

    private Path sourceFile;

    private Path targetFile;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @BeforeEach
    void setUp() {
        sourceFile = tempDir.resolve("source.db");
        targetFile = tempDir.resolve("target.db");
        databaseConfig = new DatabaseConfig();
        databaseConfig.getSource().setDriver("sqlite");
        databaseConfig.getSource().setPath(sourceFile.toString());
        databaseConfig.getTarget().setDriver("sqlite");
        databaseConfig.getTarget().setPath(targetFile.toString());
        databaseConfig.getMigration().setBatchSize(4);
        databaseConfig.getMigration().setRetryBackoff(Duration.ZERO);
        command = new MigrationCommand(databaseConfig, factory, new MigrationRunner());
        seedSource();
    }

    private void seedSource() {
        DbConfig config = databaseConfig.getSource().toDbConfig();
        try (DbDriver source = factory.connect(config)) {
            source.initializeSchema();
            List<Object[]> users = new ArrayList<>();
            List<Object[]> accounts = new ArrayList<>();
            List<Object[]> transactions = new ArrayList<>();
            for (int i = 1; i <= 10; i++) {
                users.add(new Object[] {i, "user" + i + "@example.com", "User " + i});
                accounts.add(new Object[] {i, i, i * 100});
                transactions.add(new Object[] {i, i, i * 10, "memo " + i});
            }
            try (DbTransaction tx = source.beginTransaction()) {
                tx.executeBatch("INSERT INTO users (id, email, full_name) VALUES (?, ?, ?)",
                        users);
                tx.executeBatch("INSERT INTO accounts (id, user_id, balance) VALUES (?, ?, ?)",
                        accounts);
                tx.executeBatch("INSERT INTO transactions (id, account_id, amount, memo) "
                        + "VALUES (?, ?, ?, ?)", transactions);
                tx.commit();
            }
        }
    }

    private long countTarget(String table) {
        try (DbDriver target = factory.connect(databaseConfig.getTarget().toDbConfig())) {
            return target.queryMany("SELECT COUNT(*) FROM " + table, (rs, n) -> rs.getLong(1))
                    .get(0);
        }
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void execute_正常ケース_スキーマ初期化付きで全テーブルを移行する_終了コード0で全行が転送されること() {
        int exit = command.execute(out, "--init-schema");

        assertEquals(MigrationCommand.EXIT_OK, exit);
        assertEquals(10L, countTarget("users"));
        assertEquals(10L, countTarget("accounts"));
        assertEquals(10L, countTarget("transactions"));
        String summary = output();
        assertTrue(summary.contains("state=COMPLETED rows=30"));
        assertTrue(summary.indexOf("users ") < summary.indexOf("accounts "));
        assertTrue(summary.indexOf("accounts ") < summary.indexOf("transactions "));
    }

    @Test
    void execute_正常ケース_テーブルを指定する_指定テーブルのみ移行されること() {
        int exit = command.execute(out, "--init-schema", "--tables", "users",
                "--batch-size=3");

        assertEquals(MigrationCommand.EXIT_OK, exit);
        assertEquals(10L, countTarget("users"));
        assertEquals(0L, countTarget("accounts"));
    }

    @Test
    void execute_正常ケース_テーブル未指定_依存関係解決の順序で移行されること() {
        try (MockedStatic<TableDependencyResolver> resolver =
                mockStatic(TableDependencyResolver.class)) {
            resolver.when(() -> TableDependencyResolver.resolveOrder(any(DbDriver.class),
                    anyList())).thenReturn(List.of("users"));

            int exit = command.execute(out, "--init-schema");

            assertEquals(MigrationCommand.EXIT_OK, exit);
            resolver.verify(() -> TableDependencyResolver.resolveOrder(any(DbDriver.class),
                    anyList()));
        }
        assertEquals(10L, countTarget("users"));
        assertEquals(0L, countTarget("accounts"));
        assertTrue(output().contains("state=COMPLETED rows=10"));
    }

    @Test
    void execute_正常ケース_チェックポイントを指定して再実行する_保存された位置から再開され重複しないこと() {
        Path checkpoint = tempDir.resolve("state/checkpoint.yml");

        assertEquals(MigrationCommand.EXIT_OK, command.execute(out, "--init-schema",
                "--checkpoint", checkpoint.toString()));
        assertTrue(Files.exists(checkpoint));
        assertEquals(10L,
                new MigrationCheckpointStore(checkpoint).load().committedOffset("users"));

        buffer.reset();
        int exit = command.execute(out, "--checkpoint", checkpoint.toString());

        assertEquals(MigrationCommand.EXIT_OK, exit);
        assertTrue(output().contains("state=COMPLETED rows=0"));
        assertEquals(10L, countTarget("users"));
    }

    @Test
    void execute_異常ケース_ターゲットにテーブルがない_終了コード1で結果が出力されること() {
        int exit = command.execute(out, "--tables", "users", "--retries", "1");

        assertEquals(ErrorHandler.EXIT_FAILURE, exit);
        assertTrue(output().contains("state=PARTIALLY_COMPLETED"));
        assertTrue(output().contains("error: "));
    }

    @Test
    void execute_異常ケース_ソースに接続できない_終了コード1が返されること() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        int exit = command.execute(out, "--source-path", blocker.resolve("sub/app.db").toString());

        assertEquals(ErrorHandler.EXIT_FAILURE, exit);
    }

    @Test
    void execute_異常ケース_不正な引数_終了コード2が返されること() {
        assertEquals(ErrorHandler.EXIT_USAGE, command.execute(out, "--bogus"));
        assertEquals(ErrorHandler.EXIT_USAGE, command.execute(out, "--batch-size", "0"));
        assertEquals(ErrorHandler.EXIT_USAGE, command.execute(out, "--source-driver", "oracle"));
        assertEquals(ErrorHandler.EXIT_USAGE,
                command.execute(out, "--target-driver", "postgres"));
        assertEquals(ErrorHandler.EXIT_USAGE,
                command.execute(out, "--tables", "users;DROP TABLE users"));
    }

    @Test
    void execute_正常ケース_ヘルプを指定する_使い方が出力され終了コード0が返されること() {
        int exit = command.execute(out, "--help");

        assertEquals(MigrationCommand.EXIT_OK, exit);
        assertTrue(output().contains("Usage: dbbridge [options]"));
        assertTrue(Files.notExists(targetFile));
    }
}
