package com.lantromipis.pgasync.postgresprotocol.exception;

public class PgAsyncException extends RuntimeException {
    public PgAsyncException() {
    }

    public PgAsyncException(String message) {
        super(message);
    }

    public PgAsyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public PgAsyncException(Throwable cause) {
        super(cause);
    }
}
