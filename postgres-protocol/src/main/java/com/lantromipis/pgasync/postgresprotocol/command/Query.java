package com.lantromipis.pgasync.postgresprotocol.command;

import com.lantromipis.pgasync.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import lombok.Getter;

/**
 * Simple query. Receives all rows until ReadyForQuery.
 */
@Getter
public final class Query extends AbstractObservedCommand implements PgCommand {
    private final String sql;

    public Query(String sql, CommandObserver observer) {
        super(observer);
        this.sql = sql;
    }

    @Override
    public ByteBuf encode(ByteBufAllocator allocator) {
        return ClientPostgresProtocolMessageEncoder.encodeSimpleQueryMessage(sql, allocator);
    }

    @Override
    public String getDescription() {
        return sql;
    }

    @Override
    public String toString() {
        return "Query(" + sql + ")";
    }
}
