package com.lantromipis.pgasync.postgresprotocol.command;

import com.lantromipis.pgasync.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import lombok.Getter;

/**
 * Ends extended protocol statement. Carries observer of the whole Parse, Bind, Describe, Execute sequence.
 */
@Getter
public final class Sync extends AbstractObservedCommand implements PgCommand {
    /**
     * SQL of statement this sync finishes. Used in error messages.
     */
    private final String sql;

    public Sync(String sql, CommandObserver observer) {
        super(observer);
        this.sql = sql;
    }

    @Override
    public ByteBuf encode(ByteBufAllocator allocator) {
        return ClientPostgresProtocolMessageEncoder.encodeSyncMessage(allocator);
    }

    @Override
    public String getDescription() {
        return sql;
    }

    @Override
    public String toString() {
        return "Sync(" + sql + ")";
    }
}
