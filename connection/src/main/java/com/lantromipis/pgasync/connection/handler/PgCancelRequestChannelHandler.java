package com.lantromipis.pgasync.connection.handler;

import com.lantromipis.pgasync.connection.utils.PgChannelUtils;
import com.lantromipis.pgasync.postgresprotocol.command.CancelRequest;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * Handler of short-lived side channel. Sends CancelRequest as soon as channel is active and closes the channel.
 */
@Slf4j
public class PgCancelRequestChannelHandler extends ChannelInboundHandlerAdapter {

    private final CancelRequest cancelRequest;

    public PgCancelRequestChannelHandler(final CancelRequest cancelRequest) {
        this.cancelRequest = cancelRequest;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Sending cancel request for backend process {}", cancelRequest.getProcessId());
        PgChannelUtils.closeOnFlush(ctx.channel(), cancelRequest.encode(ctx.alloc()));
        super.channelActive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        // server does not answer cancel requests
        ReferenceCountUtil.release(msg);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Error in cancel request channel", cause);
        ctx.channel().close();
    }
}
