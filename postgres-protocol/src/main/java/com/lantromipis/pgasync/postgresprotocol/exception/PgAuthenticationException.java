package com.lantromipis.pgasync.postgresprotocol.exception;

public class PgAuthenticationException extends PgConnectionException {
    public PgAuthenticationException() {
    }

    public PgAuthenticationException(String message) {
        super(message);
    }

    public PgAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    public PgAuthenticationException(Throwable cause) {
        super(cause);
    }
}
