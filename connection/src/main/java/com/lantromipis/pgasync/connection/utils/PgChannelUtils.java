package com.lantromipis.pgasync.connection.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

public class PgChannelUtils {

    /**
     * Closes the specified channel after all queued write requests are flushed.
     */
    public static void closeOnFlush(Channel channel) {
        if (channel == null) {
            return;
        }

        if (channel.isActive()) {
            channel.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    /**
     * Writes message and closes the specified channel after it is flushed.
     */
    public static void closeOnFlush(Channel channel, ByteBuf message) {
        if (channel == null) {
            message.release();
            return;
        }

        if (channel.isActive()) {
            channel.writeAndFlush(message).addListener(ChannelFutureListener.CLOSE);
        } else {
            message.release();
        }
    }

    private PgChannelUtils() {
    }
}
