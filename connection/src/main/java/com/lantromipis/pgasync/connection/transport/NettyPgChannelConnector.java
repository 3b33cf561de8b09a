package com.lantromipis.pgasync.connection.transport;

import com.lantromipis.pgasync.configuration.properties.PgConnectionProperties;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.EventExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

@Slf4j
public class NettyPgChannelConnector implements PgChannelConnector {

    private final EventLoopGroup workerGroup;
    private final PgConnectionProperties properties;
    private final Class<? extends Channel> channelClass;

    public NettyPgChannelConnector(final EventLoopGroup workerGroup, final PgConnectionProperties properties) {
        this.workerGroup = workerGroup;
        this.properties = properties;
        this.channelClass = workerGroup instanceof EpollEventLoopGroup ? EpollSocketChannel.class : NioSocketChannel.class;
    }

    /**
     * Creates group compatible with channels created by this connector.
     *
     * @param threads number of threads, 0 means Netty default
     */
    public static EventLoopGroup createEventLoopGroup(int threads) {
        if (Epoll.isAvailable()) {
            return new EpollEventLoopGroup(threads);
        }
        return new NioEventLoopGroup(threads);
    }

    @Override
    public EventExecutor nextExecutor() {
        return workerGroup.next();
    }

    @Override
    public void connect(EventExecutor executor, ChannelHandler handler, Consumer<Channel> onConnected, Consumer<Throwable> onFailure) {
        Bootstrap bootstrap = createBootstrap(executor instanceof EventLoop eventLoop ? eventLoop : workerGroup, handler);

        ChannelFuture channelFuture = bootstrap.connect();

        channelFuture.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                log.debug("Connected to Postgres {}:{}", properties.host(), properties.port());
                onConnected.accept(future.channel());
            } else {
                log.debug("Failed to connect to Postgres {}:{}", properties.host(), properties.port(), future.cause());
                onFailure.accept(future.cause());
            }
        });
    }

    private Bootstrap createBootstrap(EventLoopGroup group, ChannelHandler handler) {
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(channelClass)
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis())
                .handler(handler)
                .remoteAddress(properties.host(), properties.port());

        return bootstrap;
    }
}
