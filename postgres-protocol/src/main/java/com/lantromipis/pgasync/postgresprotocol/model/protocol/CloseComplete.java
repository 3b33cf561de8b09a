package com.lantromipis.pgasync.postgresprotocol.model.protocol;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString
@EqualsAndHashCode
public final class CloseComplete implements BackendMessage {
    public static final CloseComplete INSTANCE = new CloseComplete();

    private CloseComplete() {
    }

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.CLOSE_COMPLETE_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitCloseComplete(this);
    }
}
