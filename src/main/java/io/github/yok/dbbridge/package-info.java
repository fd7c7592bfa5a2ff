/**
 * DbBridge: a dialect-neutral database layer for SQLite and PostgreSQL with idempotent schema
 * application and a resumable batch migration tool.
 */
package io.github.yok.dbbridge;
