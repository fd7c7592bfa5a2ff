/**
 * PostgreSQL driver.
 */
package io.github.yok.dbbridge.db.postgresql;
