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
public final class Execute implements PgCommand {
    private final String portalName;
    private final int maxRows;

    @Override
    public ByteBuf encode(ByteBufAllocator allocator) {
        return ClientPostgresProtocolMessageEncoder.encodeExecuteMessage(portalName, maxRows, allocator);
    }
}
