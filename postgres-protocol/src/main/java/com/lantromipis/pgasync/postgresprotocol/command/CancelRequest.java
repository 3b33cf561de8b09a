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
public final class CancelRequest implements PgCommand {
    private final int processId;
    private final int secretKey;

    @Override
    public ByteBuf encode(ByteBufAllocator allocator) {
        return ClientPostgresProtocolMessageEncoder.encodeCancelRequestMessage(processId, secretKey, allocator);
    }
}
