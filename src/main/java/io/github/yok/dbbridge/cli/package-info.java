/**
 * Command-line front end of the migration tool.
 */
package io.github.yok.dbbridge.cli;
