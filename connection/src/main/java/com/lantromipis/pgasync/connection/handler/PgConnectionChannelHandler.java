package com.lantromipis.pgasync.connection.handler;

import com.lantromipis.pgasync.connection.PgConnection;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import lombok.extern.slf4j.Slf4j;

/**
 * Passes everything received from Postgres to connection. Channel must be registered on connection event loop.
 */
@Slf4j
public class PgConnectionChannelHandler extends ChannelInboundHandlerAdapter {

    private final PgConnection connection;

    public PgConnectionChannelHandler(final PgConnection connection) {
        this.connection = connection;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        connection.onChannelRead((ByteBuf) msg);
        ctx.channel().read();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        connection.onChannelInactive();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Exception in Postgres connection channel", cause);
        connection.onTransportError(cause);
    }
}
