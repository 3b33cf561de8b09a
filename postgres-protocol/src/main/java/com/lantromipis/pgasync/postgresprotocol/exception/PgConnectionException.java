package com.lantromipis.pgasync.postgresprotocol.exception;

public class PgConnectionException extends PgAsyncException {
    public PgConnectionException() {
    }

    public PgConnectionException(String message) {
        super(message);
    }

    public PgConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public PgConnectionException(Throwable cause) {
        super(cause);
    }
}
