package com.lantromipis.pgasync.configuration.properties;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Settings of a single connection to Postgres. Everything except {@code host}, {@code port} and {@code password}
 * that is sent to the server goes into the startup message.
 */
@ConfigMapping(prefix = "pg-async.connection")
public interface PgConnectionProperties {

    @WithDefault("127.0.0.1")
    String host();

    @WithDefault("5432")
    int port();

    String user();

    String database();

    Optional<String> password();

    /**
     * If true, connection sends Terminate as soon as its command queue becomes empty.
     */
    @WithDefault("false")
    boolean autoDisconnect();

    Optional<String> applicationName();

    @WithDefault("PT10S")
    Duration connectTimeout();

    /**
     * Max number of named prepared statements kept per connection. 0 means unnamed statement is used for every call.
     */
    @WithDefault("0")
    int preparedStatementCacheSize();

    /**
     * Additional startup parameters, e.g. {@code search_path} or {@code client_encoding}.
     */
    Map<String, String> startupParameters();
}
