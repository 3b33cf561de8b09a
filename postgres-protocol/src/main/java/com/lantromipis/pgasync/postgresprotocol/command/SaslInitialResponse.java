package com.lantromipis.pgasync.postgresprotocol.command;

import com.lantromipis.pgasync.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(exclude = "saslMechanismSpecificData")
@AllArgsConstructor
public final class SaslInitialResponse implements PgCommand {
    private final String nameOfSaslAuthMechanism;
    private final String saslMechanismSpecificData;

    @Override
    public ByteBuf encode(ByteBufAllocator allocator) {
        return ClientPostgresProtocolMessageEncoder.encodeSaslInitialResponseMessage(nameOfSaslAuthMechanism, saslMechanismSpecificData, allocator);
    }
}
