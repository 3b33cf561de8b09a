package com.lantromipis.pgasync.postgresprotocol.model.protocol;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString
@EqualsAndHashCode
public final class ParseComplete implements BackendMessage {
    public static final ParseComplete INSTANCE = new ParseComplete();

    private ParseComplete() {
    }

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.PARSE_COMPLETE_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitParseComplete(this);
    }
}
