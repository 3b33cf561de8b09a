package com.lantromipis.pgasync.connection.model;

public enum PgQueryState {
    IDLE,
    BUSY,
    READY,
    COPY_IN,
    COPY_OUT,
    COPY_BOTH
}
