package com.lantromipis.pgasync.connection.transport;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.util.concurrent.EventExecutor;

import java.util.function.Consumer;

/**
 * Opens transport channels to Postgres.
 */
public interface PgChannelConnector {

    /**
     * @return executor which will own state of a new connection
     */
    EventExecutor nextExecutor();

    /**
     * Connects a new channel with given handler. Channel is registered on given executor when it is an event loop.
     * Exactly one of callbacks is called.
     */
    void connect(EventExecutor executor, ChannelHandler handler, Consumer<Channel> onConnected, Consumer<Throwable> onFailure);
}
