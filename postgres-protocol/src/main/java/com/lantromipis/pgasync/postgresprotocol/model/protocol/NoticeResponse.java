package com.lantromipis.pgasync.postgresprotocol.model.protocol;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import lombok.ToString;

@ToString(callSuper = true)
public final class NoticeResponse extends ServerReportFields implements BackendMessage {

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.NOTICE_MESSAGE_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitNoticeResponse(this);
    }
}
