/**
 * Batched, resumable table migration between two drivers, with per-attempt timeouts, retries and
 * an optional YAML checkpoint.
 */
package io.github.yok.dbbridge.migration;
