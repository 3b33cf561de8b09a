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
public final class DataRow implements BackendMessage {
    /**
     * Raw column values in text format. Null element means SQL NULL.
     */
    private List<byte[]> columns;

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.DATA_ROW_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitDataRow(this);
    }
}
