package com.lantromipis.pgasync.postgresprotocol.model.protocol;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import lombok.Getter;

public enum PostgresProtocolAuthenticationMethod {
    OK(PostgresProtocolGeneralConstants.AUTH_OK_CODE),
    KERBEROS_V5(PostgresProtocolGeneralConstants.AUTH_KERBEROS_V5_CODE),
    CLEARTEXT_PASSWORD(PostgresProtocolGeneralConstants.AUTH_CLEARTEXT_PASSWORD_CODE),
    MD5_PASSWORD(PostgresProtocolGeneralConstants.AUTH_MD5_PASSWORD_CODE),
    SCM_CREDENTIAL(PostgresProtocolGeneralConstants.AUTH_SCM_CREDENTIAL_CODE),
    GSS(PostgresProtocolGeneralConstants.AUTH_GSS_CODE),
    GSS_CONTINUE(PostgresProtocolGeneralConstants.AUTH_GSS_CONTINUE_CODE),
    SSPI(PostgresProtocolGeneralConstants.AUTH_SSPI_CODE),
    SASL(PostgresProtocolGeneralConstants.SASL_AUTH_INT_MARKER),
    SASL_CONTINUE(PostgresProtocolGeneralConstants.SASL_AUTH_CHALLENGE_MARKER),
    SASL_FINAL(PostgresProtocolGeneralConstants.SASL_AUTH_COMPLETED_MARKER),
    UNKNOWN(-1);

    @Getter
    private final int protocolMethodMarker;

    PostgresProtocolAuthenticationMethod(int protocolMethodMarker) {
        this.protocolMethodMarker = protocolMethodMarker;
    }

    public static PostgresProtocolAuthenticationMethod fromMarker(int methodMarker) {
        for (PostgresProtocolAuthenticationMethod method : values()) {
            if (method.protocolMethodMarker == methodMarker) {
                return method;
            }
        }
        return UNKNOWN;
    }
}
