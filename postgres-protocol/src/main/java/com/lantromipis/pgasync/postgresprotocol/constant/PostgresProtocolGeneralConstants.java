package com.lantromipis.pgasync.postgresprotocol.constant;

public class PostgresProtocolGeneralConstants {
    public static final byte DELIMITER_BYTE = 0;
    public static final int MESSAGE_LENGTH_BYTES_COUNT = 4;
    public static final int MESSAGE_MARKER_AND_LENGTH_BYTES_COUNT = MESSAGE_LENGTH_BYTES_COUNT + 1;
    public static final int PROTOCOL_VERSION_3 = 196608;
    public static final int CANCEL_REQUEST_CODE = 80877102;
    public static final int CANCEL_REQUEST_MESSAGE_LENGTH = 16;
    public static final int NULL_VALUE_LENGTH = -1;
    public static final short TEXT_FORMAT_CODE = 0;

    public static final String STARTUP_PARAMETER_USER = "user";
    public static final String STARTUP_PARAMETER_DATABASE = "database";
    public static final String STARTUP_PARAMETER_APPLICATION_NAME = "application_name";

    // auth request codes
    public static final int AUTH_OK_CODE = 0;
    public static final int AUTH_KERBEROS_V5_CODE = 2;
    public static final int AUTH_CLEARTEXT_PASSWORD_CODE = 3;
    public static final int AUTH_MD5_PASSWORD_CODE = 5;
    public static final int AUTH_SCM_CREDENTIAL_CODE = 6;
    public static final int AUTH_GSS_CODE = 7;
    public static final int AUTH_GSS_CONTINUE_CODE = 8;
    public static final int AUTH_SSPI_CODE = 9;
    public static final int SASL_AUTH_INT_MARKER = 10;
    public static final int SASL_AUTH_CHALLENGE_MARKER = 11;
    public static final int SASL_AUTH_COMPLETED_MARKER = 12;
    public static final int MD5_SALT_LENGTH = 4;

    // backend message start chars
    public static final byte AUTH_REQUEST_START_CHAR = 'R';
    public static final byte BACKEND_KEY_DATA_START_CHAR = 'K';
    public static final byte PARAMETER_STATUS_MESSAGE_START_CHAR = 'S';
    public static final byte ROW_DESCRIPTION_START_CHAR = 'T';
    public static final byte DATA_ROW_START_CHAR = 'D';
    public static final byte COMMAND_COMPLETE_START_CHAR = 'C';
    public static final byte READY_FOR_QUERY_MESSAGE_START_CHAR = 'Z';
    public static final byte ERROR_MESSAGE_START_CHAR = 'E';
    public static final byte NOTICE_MESSAGE_START_CHAR = 'N';
    public static final byte EMPTY_QUERY_RESPONSE_START_CHAR = 'I';
    public static final byte PARSE_COMPLETE_START_CHAR = '1';
    public static final byte BIND_COMPLETE_START_CHAR = '2';
    public static final byte CLOSE_COMPLETE_START_CHAR = '3';
    public static final byte NO_DATA_START_CHAR = 'n';
    public static final byte PARAMETER_DESCRIPTION_START_CHAR = 't';
    public static final byte PORTAL_SUSPENDED_START_CHAR = 's';
    public static final byte COPY_IN_RESPONSE_START_CHAR = 'G';
    public static final byte COPY_OUT_RESPONSE_START_CHAR = 'H';

    // frontend message start bytes
    public static final byte QUERY_MESSAGE_START_BYTE = 'Q';
    public static final byte PARSE_MESSAGE_START_BYTE = 'P';
    public static final byte BIND_MESSAGE_START_BYTE = 'B';
    public static final byte DESCRIBE_MESSAGE_START_BYTE = 'D';
    public static final byte EXECUTE_MESSAGE_START_BYTE = 'E';
    public static final byte SYNC_MESSAGE_START_BYTE = 'S';
    public static final byte CLOSE_MESSAGE_START_BYTE = 'C';
    public static final byte CLIENT_TERMINATION_MESSAGE_START_CHAR = 'X';
    public static final byte CLIENT_PASSWORD_RESPONSE_START_CHAR = 'p';

    // describe / close targets
    public static final byte PORTAL_TARGET = 'P';
    public static final byte STATEMENT_TARGET = 'S';

    // ready for query
    public static final byte READY_FOR_QUERY_TRANSACTION_IDLE = 'I';
    public static final byte READY_FOR_QUERY_TRANSACTION_BLOCK = 'T';
    public static final byte READY_FOR_QUERY_TRANSACTION_FAILED = 'E';

    // type oids
    public static final int BOOL_TYPE_OID = 16;

    public static final String BOOL_TRUE_TEXT = "t";
    public static final String BOOL_FALSE_TEXT = "f";

    private PostgresProtocolGeneralConstants() {
    }
}
