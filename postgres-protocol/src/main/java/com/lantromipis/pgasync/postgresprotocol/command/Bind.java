package com.lantromipis.pgasync.postgresprotocol.command;

import com.lantromipis.pgasync.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import com.lantromipis.pgasync.postgresprotocol.utils.ParameterEncodingUtils;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public final class Bind implements PgCommand {
    private final String portalName;
    private final String statementName;
    /**
     * Parameter values in text format. Null element is SQL NULL.
     */
    @ToString.Exclude
    private final List<byte[]> parameters;

    public Bind(String portalName, String statementName, List<?> parameters) {
        this.portalName = portalName;
        this.statementName = statementName;
        this.parameters = ParameterEncodingUtils.encodeTextParameters(parameters);
    }

    @Override
    public ByteBuf encode(ByteBufAllocator allocator) {
        return ClientPostgresProtocolMessageEncoder.encodeBindMessage(portalName, statementName, parameters, allocator);
    }
}
