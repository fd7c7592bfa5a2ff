package io.github.yok.dbbridge.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.dbbridge.config.BackendKind;
import io.github.yok.dbbridge.config.DbConfig;
import io.github.yok.dbbridge.db.sqlite.SqliteDriver;
import io.github.yok.dbbridge.schema.SchemaManager;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TableDependencyResolverTest {

    @TempDir
    Path tempDir;

    private SqliteDriver driver;

    @BeforeEach
    void setUp() {
        driver = new SqliteDriver(new SchemaManager());
        driver.connect(DbConfig.builder().kind(BackendKind.SQLITE)
                .path(tempDir.resolve("deps.db").toString()).build());
        driver.execute("CREATE TABLE customers (id INTEGER PRIMARY KEY)");
        driver.execute("CREATE TABLE products (id INTEGER PRIMARY KEY)");
        driver.execute("CREATE TABLE orders (id INTEGER PRIMARY KEY, "
                + "customer_id INTEGER REFERENCES customers(id))");
        driver.execute("CREATE TABLE order_items (id INTEGER PRIMARY KEY, "
                + "order_id INTEGER REFERENCES orders(id), "
                + "product_id INTEGER REFERENCES products(id))");
    }

    @AfterEach
    void tearDown() {
        driver.close();
    }

    @Test
    void resolveOrder_正常ケース_外部キーで連なるテーブル_親が子より先に並ぶこと() {
        List<String> order = TableDependencyResolver.resolveOrder(driver,
                List.of("order_items", "orders", "products", "customers"));

        assertEquals(List.of("customers", "orders", "products", "order_items"), order);
    }

    @Test
    void resolveOrder_正常ケース_入力外のテーブルへの参照_無視されること() {
        List<String> order =
                TableDependencyResolver.resolveOrder(driver, List.of("order_items", "orders"));

        assertEquals(List.of("orders", "order_items"), order);
    }

    @Test
    void resolveOrder_正常ケース_循環参照と自己参照を含む_循環部分が末尾に英字順で追加されること() {
        driver.execute("CREATE TABLE yak (id INTEGER PRIMARY KEY, "
                + "xen_id INTEGER REFERENCES xen(id))");
        driver.execute("CREATE TABLE xen (id INTEGER PRIMARY KEY, "
                + "yak_id INTEGER REFERENCES yak(id))");
        driver.execute("CREATE TABLE tree (id INTEGER PRIMARY KEY, "
                + "parent_id INTEGER REFERENCES tree(id))");

        List<String> order =
                TableDependencyResolver.resolveOrder(driver, List.of("yak", "xen", "tree"));

        assertEquals(List.of("tree", "xen", "yak"), order);
    }

    @Test
    void resolveOrder_正常ケース_大文字小文字違いの重複_最初の表記で一度だけ返されること() {
        List<String> order = TableDependencyResolver.resolveOrder(driver,
                List.of("Customers", "customers", "orders"));

        assertEquals(List.of("Customers", "orders"), order);
    }

    @Test
    void resolveOrder_正常ケース_空または未指定_空リストが返されること() {
        assertTrue(TableDependencyResolver.resolveOrder(driver, List.of()).isEmpty());
        assertTrue(TableDependencyResolver.resolveOrder(driver, null).isEmpty());
    }

    @Test
    void resolveOrder_異常ケース_空白のテーブル名_例外が送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> TableDependencyResolver.resolveOrder(driver, Arrays.asList("orders", " ")));
    }

    @Test
    void resolveOrder_正常ケース_ドライバの全テーブルを並べる_全件が親優先で返されること() {
        List<String> order = TableDependencyResolver.resolveOrder(driver, driver.listTables());

        assertEquals(4, order.size());
        assertTrue(order.indexOf("customers") < order.indexOf("orders"));
        assertTrue(order.indexOf("orders") < order.indexOf("order_items"));
        assertTrue(order.indexOf("products") < order.indexOf("order_items"));
    }
}
