package com.lantromipis.pgasync.postgresprotocol.encoder;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

public class ClientPostgresProtocolMessageEncoder {

    public static ByteBuf encodeClientStartupMessage(short majorVersion, short minorVersion, Map<String, String> parameters, ByteBufAllocator allocator) {
        //4 bytes length + 4 bytes version + 1 byte final delimiter
        int length = 9;

        for (var e : parameters.entrySet()) {
            length += e.getKey().getBytes(StandardCharsets.UTF_8).length;
            length += e.getValue().getBytes(StandardCharsets.UTF_8).length;
            //delimiters
            length += 2;
        }

        ByteBuf buf = allocator.buffer(length);

        buf.writeInt(length);
        buf.writeShort(majorVersion);
        buf.writeShort(minorVersion);

        for (var e : parameters.entrySet()) {
            writeNullTerminatedString(buf, e.getKey());
            writeNullTerminatedString(buf, e.getValue());
        }

        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        return buf;
    }

    public static ByteBuf encodePasswordMessage(String password, ByteBufAllocator allocator) {
        byte[] passwordBytes = password.getBytes(StandardCharsets.UTF_8);

        // 4 bytes length + 1 delimiter byte
        int length = 5 + passwordBytes.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.CLIENT_PASSWORD_RESPONSE_START_CHAR);
        buf.writeInt(length);
        buf.writeBytes(passwordBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        return buf;
    }

    public static ByteBuf encodeSaslInitialResponseMessage(String mechanismName, String saslSpecificData, ByteBufAllocator allocator) {
        byte[] mechanismNameBytes = mechanismName.getBytes(StandardCharsets.UTF_8);
        byte[] saslSpecificDataBytes = saslSpecificData.getBytes(StandardCharsets.UTF_8);

        //length (int32) + 1 delimiter byte + length of sasl data (int32)
        int length = 9 + mechanismNameBytes.length + saslSpecificDataBytes.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.CLIENT_PASSWORD_RESPONSE_START_CHAR);
        buf.writeInt(length);
        buf.writeBytes(mechanismNameBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        buf.writeInt(saslSpecificDataBytes.length);
        buf.writeBytes(saslSpecificDataBytes);

        return buf;
    }

    public static ByteBuf encodeSaslResponseMessage(String saslSpecificData, ByteBufAllocator allocator) {
        byte[] saslSpecificDataBytes = saslSpecificData.getBytes(StandardCharsets.UTF_8);

        //length (int32)
        int length = 4 + saslSpecificDataBytes.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.CLIENT_PASSWORD_RESPONSE_START_CHAR);
        buf.writeInt(length);
        buf.writeBytes(saslSpecificDataBytes);

        return buf;
    }

    public static ByteBuf encodeSimpleQueryMessage(String sqlStatement, ByteBufAllocator allocator) {
        byte[] sqlStatementBytes = sqlStatement.getBytes(StandardCharsets.UTF_8);

        // 4 bytes length + 1 delimiter byte
        int length = 5 + sqlStatementBytes.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.QUERY_MESSAGE_START_BYTE);
        buf.writeInt(length);
        buf.writeBytes(sqlStatementBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        return buf;
    }

    public static ByteBuf encodeParseMessage(String statementName, String sqlStatement, ByteBufAllocator allocator) {
        byte[] statementNameBytes = statementName.getBytes(StandardCharsets.UTF_8);
        byte[] sqlStatementBytes = sqlStatement.getBytes(StandardCharsets.UTF_8);

        // 4 bytes length + 2 delimiters + 2 bytes count of specified parameter types
        int length = 8 + statementNameBytes.length + sqlStatementBytes.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.PARSE_MESSAGE_START_BYTE);
        buf.writeInt(length);
        buf.writeBytes(statementNameBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        buf.writeBytes(sqlStatementBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        // all parameter types are inferred by server
        buf.writeShort(0);

        return buf;
    }

    /**
     * Encodes Bind message with all parameters and all result columns in text format.
     *
     * @param parameters parameter values in text format, null element means SQL NULL
     */
    public static ByteBuf encodeBindMessage(String portalName, String statementName, List<byte[]> parameters, ByteBufAllocator allocator) {
        byte[] portalNameBytes = portalName.getBytes(StandardCharsets.UTF_8);
        byte[] statementNameBytes = statementName.getBytes(StandardCharsets.UTF_8);

        // 4 bytes length + 2 delimiters + 2 bytes param formats count + 2 bytes params count + 2 bytes result formats count
        int length = 12 + portalNameBytes.length + statementNameBytes.length;
        for (byte[] parameter : parameters) {
            length += 4;
            if (parameter != null) {
                length += parameter.length;
            }
        }

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.BIND_MESSAGE_START_BYTE);
        buf.writeInt(length);
        buf.writeBytes(portalNameBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        buf.writeBytes(statementNameBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        // 0 format codes means text format for all parameters
        buf.writeShort(0);

        buf.writeShort(parameters.size());
        for (byte[] parameter : parameters) {
            if (parameter == null) {
                buf.writeInt(PostgresProtocolGeneralConstants.NULL_VALUE_LENGTH);
            } else {
                buf.writeInt(parameter.length);
                buf.writeBytes(parameter);
            }
        }

        // 0 format codes means text format for all result columns
        buf.writeShort(0);

        return buf;
    }

    public static ByteBuf encodeDescribeMessage(byte target, String name, ByteBufAllocator allocator) {
        return encodeTargetedMessage(PostgresProtocolGeneralConstants.DESCRIBE_MESSAGE_START_BYTE, target, name, allocator);
    }

    public static ByteBuf encodeCloseMessage(byte target, String name, ByteBufAllocator allocator) {
        return encodeTargetedMessage(PostgresProtocolGeneralConstants.CLOSE_MESSAGE_START_BYTE, target, name, allocator);
    }

    public static ByteBuf encodeExecuteMessage(String portalName, int maxRows, ByteBufAllocator allocator) {
        byte[] portalNameBytes = portalName.getBytes(StandardCharsets.UTF_8);

        // 4 bytes length + 1 delimiter + 4 bytes max rows
        int length = 9 + portalNameBytes.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.EXECUTE_MESSAGE_START_BYTE);
        buf.writeInt(length);
        buf.writeBytes(portalNameBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        buf.writeInt(maxRows);

        return buf;
    }

    public static ByteBuf encodeSyncMessage(ByteBufAllocator allocator) {
        ByteBuf buf = allocator.buffer(5);

        buf.writeByte(PostgresProtocolGeneralConstants.SYNC_MESSAGE_START_BYTE);
        buf.writeInt(4);

        return buf;
    }

    public static ByteBuf encodeClientTerminateMessage(ByteBufAllocator allocator) {
        ByteBuf buf = allocator.buffer(5);

        buf.writeByte(PostgresProtocolGeneralConstants.CLIENT_TERMINATION_MESSAGE_START_CHAR);
        buf.writeInt(4);

        return buf;
    }

    /**
     * Cancel request has no start byte and must be the only message sent over a fresh connection.
     */
    public static ByteBuf encodeCancelRequestMessage(int processId, int secretKey, ByteBufAllocator allocator) {
        ByteBuf buf = allocator.buffer(PostgresProtocolGeneralConstants.CANCEL_REQUEST_MESSAGE_LENGTH);

        buf.writeInt(PostgresProtocolGeneralConstants.CANCEL_REQUEST_MESSAGE_LENGTH);
        buf.writeInt(PostgresProtocolGeneralConstants.CANCEL_REQUEST_CODE);
        buf.writeInt(processId);
        buf.writeInt(secretKey);

        return buf;
    }

    private static ByteBuf encodeTargetedMessage(byte startByte, byte target, String name, ByteBufAllocator allocator) {
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);

        // 4 bytes length + 1 target byte + 1 delimiter
        int length = 6 + nameBytes.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(startByte);
        buf.writeInt(length);
        buf.writeByte(target);
        buf.writeBytes(nameBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        return buf;
    }

    private static void writeNullTerminatedString(ByteBuf buf, String value) {
        buf.writeBytes(value.getBytes(StandardCharsets.UTF_8));
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
    }

    private ClientPostgresProtocolMessageEncoder() {
    }
}
