package com.lantromipis.pgasync.postgresprotocol.model.protocol;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class AuthenticationRequest implements BackendMessage {
    private PostgresProtocolAuthenticationMethod method;
    /**
     * Raw method code as sent by server. Kept for methods this client does not know.
     */
    private int methodMarker;
    /**
     * Salt for MD5 password method.
     */
    private byte[] salt;
    /**
     * Mechanisms offered by server for SASL method.
     */
    private List<String> saslMechanisms;
    /**
     * Mechanism specific data for SASL continue and SASL final.
     */
    private String saslData;

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.AUTH_REQUEST_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitAuthenticationRequest(this);
    }
}
