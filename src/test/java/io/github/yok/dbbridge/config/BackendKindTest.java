package io.github.yok.dbbridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BackendKindTest {

    @ParameterizedTest
    @ValueSource(strings = {"sqlite", "SQLite", " sqlite3 "})
    void fromValue_正常ケース_SQLiteの別名を指定する_SQLITEが返ること(String value) {
        assertEquals(BackendKind.SQLITE, BackendKind.fromValue(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"postgres", "PostgreSQL", "pgsql"})
    void fromValue_正常ケース_PostgreSQLの別名を指定する_POSTGRESが返ること(String value) {
        assertEquals(BackendKind.POSTGRES, BackendKind.fromValue(value));
    }

    @Test
    void fromValue_異常ケース_未対応のドライバを指定する_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> BackendKind.fromValue("mysql"));
        assertEquals("Unsupported database driver: mysql", ex.getMessage());
    }

    @Test
    void fromValue_異常ケース_空白を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> BackendKind.fromValue(" "));
        assertThrows(IllegalArgumentException.class, () -> BackendKind.fromValue(null));
    }

    @Test
    void getDialect_正常ケース_各バックエンドを指定する_方言タグが返ること() {
        assertEquals("sqlite", BackendKind.SQLITE.getDialect());
        assertEquals("postgres", BackendKind.POSTGRES.getDialect());
    }
}
