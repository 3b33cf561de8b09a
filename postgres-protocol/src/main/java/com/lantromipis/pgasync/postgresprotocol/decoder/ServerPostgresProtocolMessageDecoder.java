package com.lantromipis.pgasync.postgresprotocol.decoder;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolErrorAndNoticeConstant;
import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.lantromipis.pgasync.postgresprotocol.exception.MessageDecodingException;
import com.lantromipis.pgasync.postgresprotocol.model.protocol.*;
import com.lantromipis.pgasync.postgresprotocol.utils.DecoderUtils;
import io.netty.buffer.ByteBuf;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes bodies of server messages. Body is everything after start byte and length, so it must contain exactly
 * {@code length - 4} bytes.
 */
public class ServerPostgresProtocolMessageDecoder {

    public static BackendMessage decode(byte messageMarker, ByteBuf body) {
        try {
            return switch (messageMarker) {
                case PostgresProtocolGeneralConstants.AUTH_REQUEST_START_CHAR -> decodeAuthRequestMessage(body);
                case PostgresProtocolGeneralConstants.BACKEND_KEY_DATA_START_CHAR -> decodeBackendKeyData(body);
                case PostgresProtocolGeneralConstants.PARAMETER_STATUS_MESSAGE_START_CHAR -> decodeParameterStatus(body);
                case PostgresProtocolGeneralConstants.ROW_DESCRIPTION_START_CHAR -> decodeRowDescriptionMessage(body);
                case PostgresProtocolGeneralConstants.DATA_ROW_START_CHAR -> decodeDataRowMessage(body);
                case PostgresProtocolGeneralConstants.COMMAND_COMPLETE_START_CHAR -> decodeCommandCompleteMessage(body);
                case PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR -> decodeReadyForQuery(body);
                case PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR ->
                        decodeErrorOrNoticeFields(body, new ErrorResponse());
                case PostgresProtocolGeneralConstants.NOTICE_MESSAGE_START_CHAR ->
                        decodeErrorOrNoticeFields(body, new NoticeResponse());
                case PostgresProtocolGeneralConstants.EMPTY_QUERY_RESPONSE_START_CHAR -> EmptyQueryResponse.INSTANCE;
                case PostgresProtocolGeneralConstants.PARSE_COMPLETE_START_CHAR -> ParseComplete.INSTANCE;
                case PostgresProtocolGeneralConstants.BIND_COMPLETE_START_CHAR -> BindComplete.INSTANCE;
                case PostgresProtocolGeneralConstants.CLOSE_COMPLETE_START_CHAR -> CloseComplete.INSTANCE;
                case PostgresProtocolGeneralConstants.NO_DATA_START_CHAR -> NoData.INSTANCE;
                case PostgresProtocolGeneralConstants.PORTAL_SUSPENDED_START_CHAR -> PortalSuspended.INSTANCE;
                case PostgresProtocolGeneralConstants.PARAMETER_DESCRIPTION_START_CHAR -> decodeParameterDescription(body);
                case PostgresProtocolGeneralConstants.COPY_IN_RESPONSE_START_CHAR -> {
                    CopyInResponse copyInResponse = new CopyInResponse();
                    copyInResponse.setOverallFormat(body.readByte());
                    copyInResponse.setColumnFormatCodes(readFormatCodes(body));
                    yield copyInResponse;
                }
                case PostgresProtocolGeneralConstants.COPY_OUT_RESPONSE_START_CHAR -> {
                    CopyOutResponse copyOutResponse = new CopyOutResponse();
                    copyOutResponse.setOverallFormat(body.readByte());
                    copyOutResponse.setColumnFormatCodes(readFormatCodes(body));
                    yield copyOutResponse;
                }
                default -> new UnknownMessage(messageMarker, body.readableBytes() + PostgresProtocolGeneralConstants.MESSAGE_LENGTH_BYTES_COUNT);
            };
        } catch (MessageDecodingException e) {
            throw e;
        } catch (Exception e) {
            throw new MessageDecodingException("Error decoding message with start char '" + (char) messageMarker + "'. ", e);
        }
    }

    public static AuthenticationRequest decodeAuthRequestMessage(ByteBuf body) {
        int methodMarker = body.readInt();
        PostgresProtocolAuthenticationMethod method = PostgresProtocolAuthenticationMethod.fromMarker(methodMarker);

        AuthenticationRequest ret = AuthenticationRequest
                .builder()
                .method(method)
                .methodMarker(methodMarker)
                .build();

        switch (method) {
            case MD5_PASSWORD -> {
                byte[] salt = new byte[PostgresProtocolGeneralConstants.MD5_SALT_LENGTH];
                body.readBytes(salt);
                ret.setSalt(salt);
            }
            case SASL -> {
                List<String> mechanisms = new ArrayList<>();
                while (body.isReadable()) {
                    String mechanism = DecoderUtils.readNextNullTerminatedString(body);
                    if (mechanism.isEmpty()) {
                        break;
                    }
                    mechanisms.add(mechanism);
                }
                ret.setSaslMechanisms(mechanisms);
            }
            case SASL_CONTINUE, SASL_FINAL -> ret.setSaslData(DecoderUtils.readRemainingAsString(body));
            default -> {
                // no method specific data
            }
        }

        return ret;
    }

    public static BackendKeyData decodeBackendKeyData(ByteBuf body) {
        return BackendKeyData
                .builder()
                .processId(body.readInt())
                .secretKey(body.readInt())
                .build();
    }

    public static ParameterStatus decodeParameterStatus(ByteBuf body) {
        return ParameterStatus
                .builder()
                .parameterName(DecoderUtils.readNextNullTerminatedString(body))
                .parameterValue(DecoderUtils.readNextNullTerminatedString(body))
                .build();
    }

    public static RowDescription decodeRowDescriptionMessage(ByteBuf body) {
        short numOfFieldsInRow = body.readShort();
        List<RowDescription.FieldDescription> fieldDescriptions = new ArrayList<>(numOfFieldsInRow);

        for (short i = 0; i < numOfFieldsInRow; i++) {
            String fieldName = DecoderUtils.readNextNullTerminatedString(body);

            int tableOid = body.readInt();
            short columnAttributeNumber = body.readShort();
            int fieldDataTypeOid = body.readInt();
            short fieldDataTypeSize = body.readShort();
            int typeModifier = body.readInt();
            short formatCode = body.readShort();

            fieldDescriptions.add(
                    RowDescription.FieldDescription
                            .builder()
                            .fieldName(fieldName)
                            .tableOid(tableOid)
                            .columnAttributeNumber(columnAttributeNumber)
                            .fieldDataTypeOid(fieldDataTypeOid)
                            .fieldDataTypeSize(fieldDataTypeSize)
                            .typeModifier(typeModifier)
                            .formatCode(formatCode)
                            .build()
            );
        }

        return RowDescription
                .builder()
                .fieldDescriptions(fieldDescriptions)
                .build();
    }

    public static DataRow decodeDataRowMessage(ByteBuf body) {
        short numberOfColumns = body.readShort();
        List<byte[]> columns = new ArrayList<>(numberOfColumns);

        for (short i = 0; i < numberOfColumns; i++) {
            int columnLength = body.readInt();
            if (columnLength == PostgresProtocolGeneralConstants.NULL_VALUE_LENGTH) {
                columns.add(null);
            } else {
                byte[] columnData = new byte[columnLength];
                body.readBytes(columnData, 0, columnLength);
                columns.add(columnData);
            }
        }

        return DataRow
                .builder()
                .columns(columns)
                .build();
    }

    public static CommandComplete decodeCommandCompleteMessage(ByteBuf body) {
        return CommandComplete
                .builder()
                .commandTag(DecoderUtils.readNextNullTerminatedString(body))
                .build();
    }

    public static ReadyForQuery decodeReadyForQuery(ByteBuf body) {
        return ReadyForQuery
                .builder()
                .transactionStatus((char) body.readByte())
                .build();
    }

    public static ParameterDescription decodeParameterDescription(ByteBuf body) {
        short numberOfParameters = body.readShort();
        List<Integer> oids = new ArrayList<>(numberOfParameters);

        for (short i = 0; i < numberOfParameters; i++) {
            oids.add(body.readInt());
        }

        return ParameterDescription
                .builder()
                .parameterTypeOids(oids)
                .build();
    }

    public static <T extends ServerReportFields> T decodeErrorOrNoticeFields(ByteBuf body, T ret) {
        while (body.isReadable()) {
            byte fieldType = body.readByte();

            if (fieldType == PostgresProtocolGeneralConstants.DELIMITER_BYTE) {
                break;
            }

            String value = DecoderUtils.readNextNullTerminatedString(body);
            ret.getAllFields().put((char) fieldType, value);

            switch (fieldType) {
                case PostgresProtocolErrorAndNoticeConstant.SEVERITY_LOCALIZED_MARKER -> {
                    if (ret.getSeverity() == null) {
                        ret.setSeverity(value);
                    }
                }
                // not localized severity is preferred because it is never translated
                case PostgresProtocolErrorAndNoticeConstant.SEVERITY_NOT_LOCALIZED_MARKER -> ret.setSeverity(value);
                case PostgresProtocolErrorAndNoticeConstant.SQLSTATE_CODE_MARKER -> ret.setCode(value);
                case PostgresProtocolErrorAndNoticeConstant.MESSAGE_MARKER -> ret.setMessage(value);
                case PostgresProtocolErrorAndNoticeConstant.DETAIL_MARKER -> ret.setDetail(value);
                case PostgresProtocolErrorAndNoticeConstant.HINT_MARKER -> ret.setHint(value);
                case PostgresProtocolErrorAndNoticeConstant.POSITION_MARKER -> ret.setPosition(value);
                case PostgresProtocolErrorAndNoticeConstant.WHERE_MARKER -> ret.setWhere(value);
                default -> {
                    // kept in all fields only
                }
            }
        }

        return ret;
    }

    private static List<Short> readFormatCodes(ByteBuf body) {
        short count = body.readShort();
        List<Short> ret = new ArrayList<>(count);

        for (short i = 0; i < count; i++) {
            ret.add(body.readShort());
        }

        return ret;
    }

    private ServerPostgresProtocolMessageDecoder() {
    }
}
