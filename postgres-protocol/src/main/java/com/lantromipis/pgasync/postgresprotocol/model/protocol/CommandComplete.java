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
public final class CommandComplete implements BackendMessage {
    private String commandTag;

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.COMMAND_COMPLETE_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitCommandComplete(this);
    }
}
