package com.lantromipis.pgasync.postgresprotocol.utils;

import com.lantromipis.pgasync.postgresprotocol.model.protocol.ServerReportFields;
import org.apache.commons.lang3.StringUtils;

public class PostgresErrorMessageUtils {

    public static String getLoggableErrorMessageFromErrorResponse(ServerReportFields errorResponse) {
        if (errorResponse == null) {
            return null;
        }

        if (errorResponse.getMessage() == null) {
            return "no message";
        }

        return errorResponse.getMessage();
    }

    /**
     * Builds text like {@code ERROR 42601: syntax error at or near "SELEC" (hint: ...) in query: SELEC 1}.
     */
    public static String getLoggableErrorMessageFromErrorResponse(ServerReportFields errorResponse, String queryString) {
        if (errorResponse == null) {
            return null;
        }

        StringBuilder builder = new StringBuilder();

        if (StringUtils.isNotEmpty(errorResponse.getSeverity())) {
            builder.append(errorResponse.getSeverity()).append(' ');
        }
        if (StringUtils.isNotEmpty(errorResponse.getCode())) {
            builder.append(errorResponse.getCode()).append(": ");
        }

        builder.append(getLoggableErrorMessageFromErrorResponse(errorResponse));

        if (StringUtils.isNotEmpty(errorResponse.getDetail())) {
            builder.append(" (detail: ").append(errorResponse.getDetail()).append(')');
        }
        if (StringUtils.isNotEmpty(errorResponse.getHint())) {
            builder.append(" (hint: ").append(errorResponse.getHint()).append(')');
        }
        if (StringUtils.isNotEmpty(queryString)) {
            builder.append(" in query: ").append(queryString);
        }

        return builder.toString();
    }

    private PostgresErrorMessageUtils() {
    }
}
