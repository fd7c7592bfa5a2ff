package io.github.yok.dbbridge.migration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.dbbridge.config.BackendKind;
import io.github.yok.dbbridge.config.DbConfig;
import io.github.yok.dbbridge.db.DbDriver;
import io.github.yok.dbbridge.db.DbTransaction;
import io.github.yok.dbbridge.db.ExecResult;
import io.github.yok.dbbridge.db.sqlite.SqliteDriver;
import io.github.yok.dbbridge.error.ConnectionException;
import io.github.yok.dbbridge.error.MigrationException;
import io.github.yok.dbbridge.error.QueryException;
import io.github.yok.dbbridge.schema.SchemaManager;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongPredicate;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MigrationRunnerTest {

    private static final String CREATE_ITEMS =
            "CREATE TABLE items (id INTEGER PRIMARY KEY, name TEXT NOT NULL, amount REAL)";

    private static final String CREATE_TAGS =
            "CREATE TABLE tags (id INTEGER PRIMARY KEY, item_id INTEGER REFERENCES items(id), "
                    + "label TEXT)";

    @TempDir
    Path tempDir;

    private final MigrationRunner runner = new MigrationRunner();

    private SqliteDriver source;

    private SqliteDriver target;

    @BeforeEach
    void setUp() {
        source = sqlite("source.db");
        target = sqlite("target.db");
        source.execute(CREATE_ITEMS);
        source.execute(CREATE_TAGS);
        target.execute(CREATE_ITEMS);
        target.execute(CREATE_TAGS);
    }

    @AfterEach
    void tearDown() {
        // Clear a flag left by the interruption tests
        Thread.interrupted();
        source.close();
        target.close();
    }

    private SqliteDriver sqlite(String file) {
        SqliteDriver driver = new SqliteDriver(new SchemaManager());
        driver.connect(DbConfig.builder().kind(BackendKind.SQLITE)
                .path(tempDir.resolve(file).toString())
                .connectionTimeout(Duration.ofSeconds(2)).build());
        return driver;
    }

    private void seedItems(int rows) {
        List<Object[]> batch = new ArrayList<>();
        for (int i = 1; i <= rows; i++) {
            batch.add(new Object[] {i, "item-" + i, i * 1.5});
        }
        try (DbTransaction tx = source.beginTransaction()) {
            tx.executeBatch("INSERT INTO items (id, name, amount) VALUES (?, ?, ?)", batch);
            tx.commit();
        }
    }

    private void seedTags(int rows) {
        List<Object[]> batch = new ArrayList<>();
        for (int i = 1; i <= rows; i++) {
            batch.add(new Object[] {i, 1, "tag-" + i});
        }
        try (DbTransaction tx = source.beginTransaction()) {
            tx.executeBatch("INSERT INTO tags (id, item_id, label) VALUES (?, ?, ?)", batch);
            tx.commit();
        }
    }

    private long count(DbDriver driver, String table) {
        return driver.queryMany("SELECT COUNT(*) FROM " + table, (rs, n) -> rs.getLong(1)).get(0);
    }

    private MigrationJob.MigrationJobBuilder job(DbDriver to, String... tables) {
        return MigrationJob.builder().source(source).target(to).tables(List.of(tables))
                .batchSize(100).attemptTimeout(Duration.ofSeconds(10)).maxAttempts(3)
                .retryBackoff(Duration.ZERO);
    }

    @Test
    void run_正常ケース_1050行をバッチ100で移行する_11バッチで全行が転送されること() {
        seedItems(1050);

        MigrationResult result = runner.run(job(target, "items").build());

        assertEquals(MigrationState.COMPLETED, result.getState());
        assertTrue(result.isCompleted());
        assertFalse(result.getError().isPresent());
        TableResult items = result.table("items");
        assertEquals(TableState.COMPLETED, items.getState());
        assertEquals(11, items.getBatchesCommitted());
        assertEquals(1050L, items.getRowsTransferred());
        assertEquals(1050L, items.getTotalRows());
        assertEquals(1050L, items.getCommittedOffset());
        assertEquals(1050L, count(target, "items"));
        assertEquals(1050L, result.getRowsTransferred());

        Map<String, Object> row = target.queryOne("SELECT * FROM items WHERE id = ?", 777)
                .orElseThrow();
        assertEquals("item-777", row.get("name"));
        assertEquals(777 * 1.5, ((Number) row.get("amount")).doubleValue());
    }

    @Test
    void run_正常ケース_複数テーブルと空テーブルを指定する_指定順に全て完了すること() {
        seedItems(30);
        seedTags(5);
        source.execute("CREATE TABLE empty_table (id INTEGER PRIMARY KEY)");
        target.execute("CREATE TABLE empty_table (id INTEGER PRIMARY KEY)");

        MigrationResult result =
                runner.run(job(target, "items", "tags", "empty_table").batchSize(7).build());

        assertEquals(MigrationState.COMPLETED, result.getState());
        assertEquals(List.of("items", "tags", "empty_table"),
                List.copyOf(result.getTables().keySet()));
        assertEquals(5, result.table("items").getBatchesCommitted());
        assertEquals(1, result.table("tags").getBatchesCommitted());
        assertEquals(0, result.table("empty_table").getBatchesCommitted());
        assertEquals(TableState.COMPLETED, result.table("empty_table").getState());
        assertEquals(5L, count(target, "tags"));
    }

    @Test
    void run_正常ケース_完了済みジョブを再実行する_行が重複せず0行転送となること() {
        seedItems(250);
        MigrationJob job = job(target, "items").build();
        runner.run(job);

        MigrationResult again = runner.run(job);

        assertEquals(MigrationState.COMPLETED, again.getState());
        assertEquals(0L, again.table("items").getRowsTransferred());
        assertEquals(250L, count(target, "items"));
    }

    @Test
    void run_正常ケース_上限未満の失敗を指定する_再試行で成功し全行が転送されること() {
        seedItems(300);
        SqliteDriver flaky = spy(target);
        AtomicInteger calls = new AtomicInteger();
        doAnswer(inv -> {
            // batch 2 fails on its first two attempts
            int call = calls.incrementAndGet();
            if (call == 2 || call == 3) {
                throw new ConnectionException("transient");
            }
            return inv.callRealMethod();
        }).when(flaky).beginTransaction(any());

        MigrationResult result = runner.run(job(flaky, "items").build());

        assertEquals(MigrationState.COMPLETED, result.getState());
        assertEquals(3, result.table("items").getBatchesCommitted());
        assertEquals(300L, count(target, "items"));
        assertEquals(5, calls.get());
    }

    @Test
    void run_異常ケース_上限回数ちょうど失敗する_MigrationExceptionにテーブルとオフセットが含まれ後続がスキップされること() {
        seedItems(300);
        seedTags(3);
        SqliteDriver failing = spy(target);
        AtomicInteger calls = new AtomicInteger();
        doAnswer(inv -> {
            // batch 2 fails on all three attempts
            int call = calls.incrementAndGet();
            if (call >= 2 && call <= 4) {
                throw new ConnectionException("down");
            }
            return inv.callRealMethod();
        }).when(failing).beginTransaction(any());

        MigrationResult result = runner.run(job(failing, "items", "tags").build());

        assertEquals(MigrationState.PARTIALLY_COMPLETED, result.getState());
        MigrationException error = result.getError().orElseThrow();
        assertEquals("items", error.getTable());
        assertEquals(100L, error.getCommittedOffset());
        assertTrue(error.getCause() instanceof ConnectionException);
        assertEquals(TableState.FAILED, result.table("items").getState());
        assertEquals(100L, result.table("items").getCommittedOffset());
        assertEquals(result.table("items").getError().orElseThrow(), error);
        assertEquals(TableState.SKIPPED, result.table("tags").getState());
        assertEquals(100L, count(target, "items"));
        assertEquals(0L, count(target, "tags"));
        assertEquals(4, calls.get());
    }

    @Test
    void run_正常ケース_失敗後に再開する_全行がちょうど一度だけ転送されること() {
        seedItems(1050);
        SqliteDriver failing = spy(target);
        AtomicInteger calls = new AtomicInteger();
        doAnswer(inv -> {
            if (calls.incrementAndGet() >= 5) {
                throw new ConnectionException("target lost");
            }
            return inv.callRealMethod();
        }).when(failing).beginTransaction(any());

        MigrationResult first = runner.run(job(failing, "items").maxAttempts(1).build());
        assertEquals(MigrationState.PARTIALLY_COMPLETED, first.getState());
        assertEquals(400L, first.cursor().committedOffset("items"));

        MigrationJob resumed = job(target, "items").cursor(first.cursor()).build();
        MigrationResult second = runner.run(resumed);

        assertEquals(MigrationState.COMPLETED, second.getState());
        assertEquals(650L, second.table("items").getRowsTransferred());
        assertEquals(7, second.table("items").getBatchesCommitted());
        assertEquals(1050L, count(target, "items"));
        assertEquals(1050L, target.queryMany("SELECT DISTINCT id FROM items").size());
    }

    @Test
    void run_異常ケース_実行中に割り込まれる_FAILEDとなりカーソルから再開できること() {
        seedItems(500);
        SqliteDriver interrupting = spy(target);
        AtomicInteger calls = new AtomicInteger();
        doAnswer(inv -> {
            if (calls.incrementAndGet() == 3) {
                Thread.currentThread().interrupt();
            }
            return inv.callRealMethod();
        }).when(interrupting).beginTransaction(any());
        MigrationJob job = job(interrupting, "items").build();

        MigrationResult result = runner.run(job);

        assertTrue(Thread.interrupted());
        assertEquals(MigrationState.FAILED, result.getState());
        long offset = result.getError().orElseThrow().getCommittedOffset();
        assertEquals(offset, count(target, "items"));
        assertTrue(offset < 500L);

        MigrationResult resumed = runner.run(job.toBuilder().target(target).build());
        assertEquals(MigrationState.COMPLETED, resumed.getState());
        assertEquals(500L, count(target, "items"));
    }

    @Test
    void run_異常ケース_書き込みが期限を超える_取消されコミットされずPARTIALLY_COMPLETEDとなること() {
        seedItems(10);
        DbDriver slow = mock(DbDriver.class);
        DbTransaction tx = mock(DbTransaction.class);
        when(slow.dialect()).thenReturn("slow");
        when(slow.beginTransaction(any())).thenReturn(tx);
        when(tx.cancel()).thenReturn(true);
        when(tx.executeBatch(anyString(), anyList())).thenAnswer(inv -> {
            try {
                Thread.sleep(10_000L);
            } catch (InterruptedException e) {
                throw new QueryException("statement cancelled", e);
            }
            return 10L;
        });

        MigrationResult result = runner.run(job(slow, "items")
                .attemptTimeout(Duration.ofMillis(200)).maxAttempts(2).build());

        assertEquals(MigrationState.PARTIALLY_COMPLETED, result.getState());
        MigrationException error = result.getError().orElseThrow();
        assertEquals(0L, error.getCommittedOffset());
        assertTrue(error.getCause().getMessage().contains("timed out"));
        verify(tx, never()).commit();
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    void run_正常ケース_期限前に開始したコミットが遅延する_成功として扱われること() {
        seedItems(10);
        DbDriver slowCommit = mock(DbDriver.class);
        DbTransaction tx = mock(DbTransaction.class);
        when(slowCommit.dialect()).thenReturn("slow-commit");
        when(slowCommit.beginTransaction(any())).thenReturn(tx);
        // The commit has begun, so the cancel is refused
        when(tx.cancel()).thenReturn(false);
        when(tx.executeBatch(anyString(), anyList())).thenReturn(10L);
        doAnswer(inv -> {
            Thread.sleep(800L);
            return null;
        }).when(tx).commit();

        MigrationResult result = runner.run(job(slowCommit, "items")
                .attemptTimeout(Duration.ofMillis(300)).maxAttempts(1).build());

        assertEquals(MigrationState.COMPLETED, result.getState());
        assertEquals(10L, result.table("items").getCommittedOffset());
        verify(tx).commit();
    }

    @Test
    void run_異常ケース_ソースに存在しないテーブルを指定する_FAILEDとなり後続がスキップされること() {
        seedItems(5);

        MigrationResult result = runner.run(job(target, "missing", "items").build());

        assertEquals(MigrationState.FAILED, result.getState());
        assertEquals("missing", result.getError().orElseThrow().getTable());
        assertEquals(TableState.FAILED, result.table("missing").getState());
        assertEquals(TableState.SKIPPED, result.table("items").getState());
        assertEquals(0L, count(target, "items"));
    }

    @Test
    void run_正常ケース_並行書き込み可能なターゲット_複数ワーカーで全行がちょうど一度転送されること() {
        seedItems(1000);
        RecordingTarget recording = new RecordingTarget(true, offset -> false);

        MigrationResult result =
                runner.run(job(recording.driver, "items").workers(4).build());

        assertEquals(MigrationState.COMPLETED, result.getState());
        assertEquals(10, result.table("items").getBatchesCommitted());
        assertEquals(1000, recording.committedIds().size());
        assertEquals(1000, Set.copyOf(recording.committedIds()).size());
        assertTrue(Set.copyOf(recording.threads).size() > 1);
        assertTrue(recording.threads.stream().allMatch(t -> t.startsWith("dbbridge-worker-")));
    }

    @Test
    void run_異常ケース_並行ワーカーで一つのバッチが失敗する_後続のコミット済み範囲が記録され再開で重複しないこと() {
        seedItems(1000);
        // Batch [200, 300) fails on every attempt
        RecordingTarget failing = new RecordingTarget(true, offset -> offset == 201L);

        MigrationResult first =
                runner.run(job(failing.driver, "items").workers(4).maxAttempts(2).build());

        assertEquals(MigrationState.PARTIALLY_COMPLETED, first.getState());
        assertEquals(200L, first.getError().orElseThrow().getCommittedOffset());
        assertEquals(List.of(new RowRange(300, 400)), first.table("items").getCommittedRanges());
        assertEquals(300, failing.committedIds().size());

        RecordingTarget healthy = new RecordingTarget(true, offset -> false);
        healthy.committed.putAll(failing.committed);
        MigrationResult second = runner.run(job(healthy.driver, "items").workers(4)
                .cursor(first.cursor()).build());

        assertEquals(MigrationState.COMPLETED, second.getState());
        assertEquals(700L, second.table("items").getRowsTransferred());
        assertEquals(1000, healthy.committedIds().size());
        assertEquals(1000, Set.copyOf(healthy.committedIds()).size());
        assertTrue(second.table("items").getCommittedRanges().isEmpty());
    }

    @Test
    void run_正常ケース_単一書き込みのターゲットで複数ワーカーを指定する_呼び出しスレッドのみで実行されること() {
        seedItems(300);
        RecordingTarget single = new RecordingTarget(false, offset -> false);

        MigrationResult result = runner.run(job(single.driver, "items").workers(4).build());

        assertEquals(MigrationState.COMPLETED, result.getState());
        assertEquals(Set.of(Thread.currentThread().getName()), Set.copyOf(single.threads));
    }

    @Test
    void run_正常ケース_コミットリスナーを指定する_バッチごとに進んだカーソルで呼ばれること() {
        seedItems(250);
        List<Long> offsets = new CopyOnWriteArrayList<>();

        runner.run(job(target, "items").commitListener(
                (table, range, cursor) -> offsets.add(cursor.committedOffset(table))).build());

        assertEquals(List.of(100L, 200L, 250L), offsets);
    }

    @Test
    void run_正常ケース_コミットリスナーが失敗する_移行は継続されること() {
        seedItems(150);

        MigrationResult result = runner.run(job(target, "items").commitListener((t, r, c) -> {
            throw new IllegalStateException("disk full");
        }).build());

        assertEquals(MigrationState.COMPLETED, result.getState());
        assertEquals(150L, count(target, "items"));
    }

    @Test
    void run_異常ケース_不正なジョブを指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> runner.run(job(target, "items").batchSize(0).build()));
        assertThrows(IllegalArgumentException.class,
                () -> runner.run(job(target, "items").maxAttempts(0).build()));
        assertThrows(IllegalArgumentException.class,
                () -> runner.run(job(target, "items").workers(0).build()));
        assertThrows(IllegalArgumentException.class,
                () -> runner.run(job(target, "items").attemptTimeout(Duration.ZERO).build()));
        assertThrows(IllegalArgumentException.class,
                () -> runner.run(job(target, "items; DROP TABLE items").build()));
        assertThrows(IllegalArgumentException.class,
                () -> runner.run(job(target, "items", "items").build()));
        assertThrows(IllegalArgumentException.class, () -> runner
                .run(job(target, "items").orderColumn("items", "id DESC").build()));
        assertEquals(0L, count(target, "items"));
    }

    @Test
    void run_正常ケース_並び順の列を指定する_指定列の順で転送されること() {
        seedItems(20);

        MigrationResult result = runner.run(
                job(target, "items").orderColumn("items", "name").batchSize(6).build());

        assertEquals(MigrationState.COMPLETED, result.getState());
        assertEquals(20L, count(target, "items"));
    }

    @Test
    void insertSql_正常ケース_特殊な列名を含む_引用符で囲まれること() {
        assertEquals("INSERT INTO t (id, \"odd name\", \"q\"\"x\") VALUES (?, ?, ?)",
                MigrationRunner.insertSql("t", List.of("id", "odd name", "q\"x")));
    }

    @Test
    void portableValue_正常ケース_非標準の型を指定する_文字列に変換されること() {
        Object uuid = java.util.UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
        assertEquals("123e4567-e89b-12d3-a456-426614174000", MigrationRunner.portableValue(uuid));
        assertEquals(5L, MigrationRunner.portableValue(5L));
        assertNull(MigrationRunner.portableValue(null));
    }

    /**
     * Target double that records committed rows per batch, keyed by the first id of the batch.
     */
    private static final class RecordingTarget {

        private final DbDriver driver = mock(DbDriver.class);

        private final Map<Long, List<Long>> committed = new ConcurrentHashMap<>();

        private final List<String> threads = new CopyOnWriteArrayList<>();

        RecordingTarget(boolean concurrent, LongPredicate failOnFirstId) {
            when(driver.dialect()).thenReturn("recording");
            when(driver.supportsConcurrentWriters()).thenReturn(concurrent);
            when(driver.beginTransaction(any())).thenAnswer(inv -> transaction(failOnFirstId));
        }

        List<Long> committedIds() {
            return committed.values().stream().flatMap(List::stream).collect(Collectors.toList());
        }

        private DbTransaction transaction(LongPredicate failOnFirstId) {
            List<Long> pending = new ArrayList<>();
            return new DbTransaction() {
                private boolean cancelled;

                @Override
                public ExecResult execute(String sql, Object... args) {
                    throw new UnsupportedOperationException();
                }

                @Override
                public long executeBatch(String sql, List<Object[]> rows) {
                    threads.add(Thread.currentThread().getName());
                    long first = ((Number) rows.get(0)[0]).longValue();
                    if (failOnFirstId.test(first)) {
                        throw new QueryException("constraint violated at " + first);
                    }
                    rows.forEach(r -> pending.add(((Number) r[0]).longValue()));
                    return rows.size();
                }

                @Override
                public List<Map<String, Object>> queryMany(String sql, Object... args) {
                    throw new UnsupportedOperationException();
                }

                @Override
                public void commit() {
                    if (cancelled) {
                        throw new QueryException("cancelled");
                    }
                    if (committed.putIfAbsent(pending.get(0), List.copyOf(pending)) != null) {
                        throw new AssertionError("batch committed twice: " + pending.get(0));
                    }
                }

                @Override
                public void rollback() {
                    pending.clear();
                }

                @Override
                public boolean cancel() {
                    cancelled = true;
                    return true;
                }

                @Override
                public void close() {
                    // nothing to release
                }
            };
        }
    }
}
