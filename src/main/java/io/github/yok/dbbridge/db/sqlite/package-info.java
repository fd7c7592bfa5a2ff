/**
 * SQLite driver.
 */
package io.github.yok.dbbridge.db.sqlite;
