/**
 * Idempotent schema application.
 */
package io.github.yok.dbbridge.schema;
