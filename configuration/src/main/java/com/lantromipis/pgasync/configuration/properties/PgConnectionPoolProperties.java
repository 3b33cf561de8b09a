package com.lantromipis.pgasync.configuration.properties;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

@ConfigMapping(prefix = "pg-async.pool")
public interface PgConnectionPoolProperties {

    @WithDefault("10")
    int maxConnections();

    /**
     * Number of Netty event loop threads shared by pooled connections. 0 means Netty default.
     */
    @WithDefault("0")
    int eventLoopThreads();
}
