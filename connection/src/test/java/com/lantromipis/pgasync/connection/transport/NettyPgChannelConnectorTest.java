package com.lantromipis.pgasync.connection.transport;

import com.lantromipis.pgasync.configuration.utils.PgAsyncConfigurationLoader;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoopGroup;
import io.netty.util.concurrent.EventExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class NettyPgChannelConnectorTest {

    private EventLoopGroup group;

    @BeforeEach
    void setUp() {
        group = NettyPgChannelConnector.createEventLoopGroup(1);
    }

    @AfterEach
    void tearDown() throws Exception {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
    }

    @Test
    void shouldRegisterChannelOnGivenExecutor() throws Exception {
        try (ServerSocket serverSocket = new ServerSocket(0)) {
            // given
            NettyPgChannelConnector connector = createConnector(serverSocket.getLocalPort());
            EventExecutor executor = connector.nextExecutor();
            CompletableFuture<Channel> connected = new CompletableFuture<>();

            // when
            connector.connect(executor, new ChannelInboundHandlerAdapter(), connected::complete, connected::completeExceptionally);

            // then
            try (Socket ignored = serverSocket.accept()) {
                Channel channel = connected.get(5, TimeUnit.SECONDS);
                assertThat(channel.isActive()).isTrue();
                assertThat((Object) channel.eventLoop()).isSameAs(executor);
                assertThat(channel.config().isAutoRead()).isFalse();
                channel.close().sync();
            }
        }
    }

    @Test
    void shouldReportFailureWhenNothingListens() throws Exception {
        // given
        int port;
        try (ServerSocket serverSocket = new ServerSocket(0)) {
            port = serverSocket.getLocalPort();
        }
        NettyPgChannelConnector connector = createConnector(port);
        CompletableFuture<Throwable> failed = new CompletableFuture<>();

        // when
        connector.connect(connector.nextExecutor(), new ChannelInboundHandlerAdapter(), channel -> failed.complete(null), failed::complete);

        // then
        assertThat(failed.get(5, TimeUnit.SECONDS)).isInstanceOf(IOException.class);
    }

    private NettyPgChannelConnector createConnector(int port) {
        return new NettyPgChannelConnector(group, PgAsyncConfigurationLoader.loadConnectionProperties(Map.of(
                "pg-async.connection.port", String.valueOf(port),
                "pg-async.connection.user", "app",
                "pg-async.connection.database", "orders"
        )));
    }
}
