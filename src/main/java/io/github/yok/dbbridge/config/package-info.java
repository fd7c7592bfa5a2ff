/**
 * Configuration model package.
 *
 * <p>
 * {@link io.github.yok.dbbridge.config.DatabaseConfig} binds {@code application.yml};
 * {@link io.github.yok.dbbridge.config.DbConfig} is the immutable value a driver is connected
 * with.
 * </p>
 */
package io.github.yok.dbbridge.config;
