package com.lantromipis.pgasync.postgresprotocol.command;

import com.lantromipis.pgasync.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

/**
 * Graceful close. Connection closes the channel right after this command is flushed.
 */
public final class Terminate implements PgCommand {

    public static final Terminate INSTANCE = new Terminate();

    private Terminate() {
    }

    @Override
    public ByteBuf encode(ByteBufAllocator allocator) {
        return ClientPostgresProtocolMessageEncoder.encodeClientTerminateMessage(allocator);
    }

    @Override
    public String toString() {
        return "Terminate";
    }
}
