package com.lantromipis.pgasync.connection.model;

/**
 * State of connection as seen by connection pool.
 */
public enum PoolClientState {
    READY,
    BUSY,
    NOT_READY,
    CLOSING;

    public static PoolClientState fromQueryState(PgQueryState queryState) {
        return switch (queryState) {
            case BUSY -> BUSY;
            case READY -> READY;
            default -> NOT_READY;
        };
    }

    public static PoolClientState fromConnectionStatus(PgConnectionStatus connectionStatus) {
        return switch (connectionStatus) {
            case CLOSED -> CLOSING;
            case OK -> READY;
            default -> NOT_READY;
        };
    }
}
