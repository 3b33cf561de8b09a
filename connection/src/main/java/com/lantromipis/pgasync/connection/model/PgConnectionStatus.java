package com.lantromipis.pgasync.connection.model;

/**
 * Lifecycle of connection: NEEDED, STARTED, MADE, AUTH_OK, OK. BAD and CLOSED can be reached from any status.
 */
public enum PgConnectionStatus {
    /**
     * Created, not started yet.
     */
    NEEDED,
    /**
     * Transport connection requested.
     */
    STARTED,
    /**
     * Transport connected, startup message sent.
     */
    MADE,
    AUTH_OK,
    OK,
    BAD,
    CLOSED
}
