package com.lantromipis.pgasync.connection.api;

import com.lantromipis.pgasync.connection.PgConnection;
import com.lantromipis.pgasync.connection.model.PoolClientState;
import com.lantromipis.pgasync.postgresprotocol.model.protocol.NoticeResponse;

/**
 * Receives connection events. All methods are called from connection event loop, so implementations must not block.
 */
public interface PgConnectionEventListener {

    /**
     * Called when state visible to pool changes.
     */
    default void stateChanged(PgConnection connection, PoolClientState newState) {
    }

    /**
     * Called when number of subscribed, not yet finished result streams changes.
     */
    default void queueCountChanged(PgConnection connection, int queueCount) {
    }

    /**
     * Called on connection level errors: transport failures, authentication failures, protocol violations and fatal
     * server errors. Statement level errors are delivered only to their result stream.
     */
    default void error(PgConnection connection, Throwable cause) {
    }

    default void closed(PgConnection connection) {
    }

    default void notice(PgConnection connection, NoticeResponse notice) {
    }

    default void parameterStatus(PgConnection connection, String parameterName, String parameterValue) {
    }
}
