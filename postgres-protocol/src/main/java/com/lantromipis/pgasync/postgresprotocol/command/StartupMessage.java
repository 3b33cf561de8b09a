package com.lantromipis.pgasync.postgresprotocol.command;

import com.lantromipis.pgasync.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

@Getter
@ToString
@AllArgsConstructor
public final class StartupMessage implements PgCommand {
    private static final short PROTOCOL_MAJOR_VERSION = 3;
    private static final short PROTOCOL_MINOR_VERSION = 0;

    /**
     * Startup parameters, user is mandatory.
     */
    private final Map<String, String> parameters;

    @Override
    public ByteBuf encode(ByteBufAllocator allocator) {
        return ClientPostgresProtocolMessageEncoder.encodeClientStartupMessage(PROTOCOL_MAJOR_VERSION, PROTOCOL_MINOR_VERSION, parameters, allocator);
    }
}
