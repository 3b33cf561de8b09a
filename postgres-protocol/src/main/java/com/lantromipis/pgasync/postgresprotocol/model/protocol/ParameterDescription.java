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
public final class ParameterDescription implements BackendMessage {
    private List<Integer> parameterTypeOids;

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.PARAMETER_DESCRIPTION_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitParameterDescription(this);
    }
}
