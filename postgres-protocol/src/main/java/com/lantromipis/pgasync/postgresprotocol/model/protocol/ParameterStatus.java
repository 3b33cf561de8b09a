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
public final class ParameterStatus implements BackendMessage {
    private String parameterName;
    private String parameterValue;

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.PARAMETER_STATUS_MESSAGE_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitParameterStatus(this);
    }
}
