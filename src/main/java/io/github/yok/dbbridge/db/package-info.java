/**
 * Database driver contract and its shared implementation.
 *
 * <p>
 * {@link io.github.yok.dbbridge.db.DbDriver} hides placeholder syntax, DDL differences and pool
 * semantics of the supported backends. Backend-specific implementations are located in the
 * subpackages {@code sqlite} and {@code postgresql};
 * {@link io.github.yok.dbbridge.db.DbDriverFactory} selects one from the configuration.
 * </p>
 */
package io.github.yok.dbbridge.db;
