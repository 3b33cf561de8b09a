package com.lantromipis.pgasync.postgresprotocol.model.protocol;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString
@EqualsAndHashCode
public final class BindComplete implements BackendMessage {
    public static final BindComplete INSTANCE = new BindComplete();

    private BindComplete() {
    }

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.BIND_COMPLETE_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitBindComplete(this);
    }
}
