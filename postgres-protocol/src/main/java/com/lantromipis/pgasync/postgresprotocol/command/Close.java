package com.lantromipis.pgasync.postgresprotocol.command;

import com.lantromipis.pgasync.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public final class Close implements PgCommand {
    private final byte target;
    private final String name;

    @Override
    public ByteBuf encode(ByteBufAllocator allocator) {
        return ClientPostgresProtocolMessageEncoder.encodeCloseMessage(target, name, allocator);
    }
}
