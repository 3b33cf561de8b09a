package com.lantromipis.pgasync.postgresprotocol.model.protocol;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString
@EqualsAndHashCode
public final class NoData implements BackendMessage {
    public static final NoData INSTANCE = new NoData();

    private NoData() {
    }

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.NO_DATA_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitNoData(this);
    }
}
