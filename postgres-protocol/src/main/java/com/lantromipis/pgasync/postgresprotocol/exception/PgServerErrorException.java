package com.lantromipis.pgasync.postgresprotocol.exception;

import com.lantromipis.pgasync.postgresprotocol.model.protocol.ErrorResponse;
import com.lantromipis.pgasync.postgresprotocol.utils.PostgresErrorMessageUtils;
import lombok.Getter;

/**
 * Error reported by Postgres server in ErrorResponse message.
 */
@Getter
public class PgServerErrorException extends PgAsyncException {
    private final ErrorResponse errorResponse;
    /**
     * SQL of the statement which caused this error. Null if error is not related to any statement.
     */
    private final String queryString;

    public PgServerErrorException(ErrorResponse errorResponse, String queryString) {
        super(PostgresErrorMessageUtils.getLoggableErrorMessageFromErrorResponse(errorResponse, queryString));
        this.errorResponse = errorResponse;
        this.queryString = queryString;
    }

    public String getSqlState() {
        return errorResponse.getCode();
    }

    public String getSeverity() {
        return errorResponse.getSeverity();
    }
}
