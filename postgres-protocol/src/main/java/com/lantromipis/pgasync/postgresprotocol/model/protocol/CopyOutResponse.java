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
public final class CopyOutResponse implements BackendMessage {
    private byte overallFormat;
    private List<Short> columnFormatCodes;

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.COPY_OUT_RESPONSE_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitCopyOutResponse(this);
    }
}
