/**
 * SQL script scanning, foreign-key table ordering and fatal error reporting.
 */
package io.github.yok.dbbridge.util;
