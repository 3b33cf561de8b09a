package com.lantromipis.pgasync.postgresprotocol.exception;

public class MessageDecodingException extends PgAsyncException {
    public MessageDecodingException() {
    }

    public MessageDecodingException(String message) {
        super(message);
    }

    public MessageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }

    public MessageDecodingException(Throwable cause) {
        super(cause);
    }
}
