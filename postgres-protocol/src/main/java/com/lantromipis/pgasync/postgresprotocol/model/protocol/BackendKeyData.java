package com.lantromipis.pgasync.postgresprotocol.model.protocol;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class BackendKeyData implements BackendMessage {
    private int processId;
    private int secretKey;

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.BACKEND_KEY_DATA_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitBackendKeyData(this);
    }
}
