package com.lantromipis.pgasync.postgresprotocol.constant;

public class PostgresProtocolErrorAndNoticeConstant {

    // Message fields https://www.postgresql.org/docs/current/protocol-error-fields.html

    public static final byte SEVERITY_LOCALIZED_MARKER = 'S';
    public static final byte SEVERITY_NOT_LOCALIZED_MARKER = 'V';
    public static final byte SQLSTATE_CODE_MARKER = 'C';
    public static final byte MESSAGE_MARKER = 'M';
    public static final byte DETAIL_MARKER = 'D';
    public static final byte HINT_MARKER = 'H';
    public static final byte POSITION_MARKER = 'P';
    public static final byte WHERE_MARKER = 'W';

    // Severity
    public static final String FATAL_SEVERITY = "FATAL";
    public static final String PANIC_SEVERITY = "PANIC";
    public static final String WARNING_SEVERITY = "WARNING";

    // SQLSTATE https://www.postgresql.org/docs/current/errcodes-appendix.html
    public static final String SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION_CLASS = "42";
    public static final String INVALID_SQL_STATEMENT_NAME_CODE = "26000";

    private PostgresProtocolErrorAndNoticeConstant() {
    }
}
