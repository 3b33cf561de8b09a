package com.lantromipis.pgasync.postgresprotocol.command;

import com.lantromipis.pgasync.postgresprotocol.model.PgRow;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

/**
 * Single outbound protocol action. Connection writes commands in FIFO order, skipping inactive ones. If command
 * waits for complete, no other command is written until server finishes processing it.
 */
public sealed interface PgCommand permits StartupMessage, PasswordMessage, SaslInitialResponse, SaslResponse, Query,
        Parse, Bind, Describe, Execute, Sync, Close, Terminate, CancelRequest {

    ByteBuf encode(ByteBufAllocator allocator);

    default boolean isActive() {
        return true;
    }

    default boolean shouldWaitForComplete() {
        return false;
    }

    /**
     * @return true if this command counts in connection backlog
     */
    default boolean isObserved() {
        return false;
    }

    default void next(PgRow row) {
    }

    default void complete() {
    }

    default void error(Throwable throwable) {
    }

    default void cancel() {
    }

    /**
     * @return SQL text for commands which carry one, null otherwise
     */
    default String getDescription() {
        return null;
    }
}
