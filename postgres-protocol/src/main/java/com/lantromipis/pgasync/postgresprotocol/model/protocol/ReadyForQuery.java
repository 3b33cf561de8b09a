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
public final class ReadyForQuery implements BackendMessage {
    /**
     * 'I' if idle, 'T' if in transaction block, 'E' if in failed transaction block.
     */
    private char transactionStatus;

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitReadyForQuery(this);
    }
}
