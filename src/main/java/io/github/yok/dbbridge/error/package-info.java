/**
 * Exception taxonomy of the database layer.
 *
 * <p>
 * {@link io.github.yok.dbbridge.error.ConnectionException} for unusable handles,
 * {@link io.github.yok.dbbridge.error.QueryException} for statement failures,
 * {@link io.github.yok.dbbridge.error.SchemaException} for schema application and
 * {@link io.github.yok.dbbridge.error.MigrationException} for exhausted migration batches.
 * </p>
 */
package io.github.yok.dbbridge.error;
