package com.lantromipis.pgasync.postgresprotocol.decoder;

import com.lantromipis.pgasync.postgresprotocol.model.protocol.*;
import com.lantromipis.pgasync.postgresprotocol.testutils.BackendMessages;
import io.netty.buffer.ByteBuf;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ServerPostgresProtocolMessageDecoderTest {

    @Nested
    class Authentication {

        @Test
        void shouldDecodeMd5RequestWithSalt() {
            // when
            AuthenticationRequest request = (AuthenticationRequest) decode(BackendMessages.authMd5Password(new byte[]{9, 8, 7, 6}));

            // then
            assertThat(request.getMethod()).isEqualTo(PostgresProtocolAuthenticationMethod.MD5_PASSWORD);
            assertThat(request.getSalt()).isEqualTo(new byte[]{9, 8, 7, 6});
        }

        @Test
        void shouldDecodeSaslMechanisms() {
            // when
            AuthenticationRequest request = (AuthenticationRequest) decode(BackendMessages.authSasl("SCRAM-SHA-256-PLUS", "SCRAM-SHA-256"));

            // then
            assertThat(request.getMethod()).isEqualTo(PostgresProtocolAuthenticationMethod.SASL);
            assertThat(request.getSaslMechanisms()).containsExactly("SCRAM-SHA-256-PLUS", "SCRAM-SHA-256");
        }

        @Test
        void shouldDecodeSaslContinueData() {
            // when
            AuthenticationRequest request = (AuthenticationRequest) decode(BackendMessages.authSaslContinue("r=abc,s=c2FsdA==,i=4096"));

            // then
            assertThat(request.getMethod()).isEqualTo(PostgresProtocolAuthenticationMethod.SASL_CONTINUE);
            assertThat(request.getSaslData()).isEqualTo("r=abc,s=c2FsdA==,i=4096");
        }

        @Test
        void shouldKeepCodeOfUnknownMethod() {
            // when
            AuthenticationRequest request = (AuthenticationRequest) decode(BackendMessages.auth(42));

            // then
            assertThat(request.getMethod()).isEqualTo(PostgresProtocolAuthenticationMethod.UNKNOWN);
            assertThat(request.getMethodMarker()).isEqualTo(42);
        }
    }

    @Test
    void shouldDecodeErrorFields() {
        // when
        ErrorResponse error = (ErrorResponse) decode(BackendMessages.errorResponse("ERROR", "42601", "syntax error at or near \"SELEC\""));

        // then
        assertThat(error.getSeverity()).isEqualTo("ERROR");
        assertThat(error.getCode()).isEqualTo("42601");
        assertThat(error.getMessage()).isEqualTo("syntax error at or near \"SELEC\"");
        assertThat(error.getAllFields()).containsKeys('S', 'V', 'C', 'M');
    }

    @Test
    void shouldDecodeNoticeLikeError() {
        // when
        NoticeResponse notice = (NoticeResponse) decode(BackendMessages.noticeResponse("WARNING", "there is no transaction in progress"));

        // then
        assertThat(notice.getSeverity()).isEqualTo("WARNING");
        assertThat(notice.getMessage()).isEqualTo("there is no transaction in progress");
    }

    @Test
    void shouldDecodeRowDescription() {
        // when
        RowDescription description = (RowDescription) decode(
                BackendMessages.rowDescription("id", BackendMessages.INT4_OID, "active", BackendMessages.BOOL_OID)
        );

        // then
        assertThat(description.getFieldDescriptions())
                .extracting(RowDescription.FieldDescription::getFieldName, RowDescription.FieldDescription::getFieldDataTypeOid)
                .containsExactly(
                        tuple("id", BackendMessages.INT4_OID),
                        tuple("active", BackendMessages.BOOL_OID)
                );
    }

    @Test
    void shouldDecodeNullColumnInDataRow() {
        // when
        DataRow row = (DataRow) decode(BackendMessages.dataRow("1", null, ""));

        // then
        assertThat(row.getColumns()).hasSize(3);
        assertThat(new String(row.getColumns().get(0), StandardCharsets.UTF_8)).isEqualTo("1");
        assertThat(row.getColumns().get(1)).isNull();
        assertThat(row.getColumns().get(2)).isEmpty();
    }

    @Test
    void shouldDecodeBackendKeyDataAndParameterStatus() {
        // when
        BackendKeyData keyData = (BackendKeyData) decode(BackendMessages.backendKeyData(1234, -99));
        ParameterStatus status = (ParameterStatus) decode(BackendMessages.parameterStatus("TimeZone", "UTC"));

        // then
        assertThat(keyData.getProcessId()).isEqualTo(1234);
        assertThat(keyData.getSecretKey()).isEqualTo(-99);
        assertThat(status.getParameterName()).isEqualTo("TimeZone");
        assertThat(status.getParameterValue()).isEqualTo("UTC");
    }

    @Test
    void shouldDecodeParameterDescription() {
        // when
        ParameterDescription description = (ParameterDescription) decode(BackendMessages.parameterDescription(23, 25));

        // then
        assertThat(description.getParameterTypeOids()).containsExactly(23, 25);
    }

    private BackendMessage decode(ByteBuf message) {
        try {
            byte marker = message.readByte();
            int length = message.readInt();
            return ServerPostgresProtocolMessageDecoder.decode(marker, message.readSlice(length - 4));
        } finally {
            message.release();
        }
    }
}
