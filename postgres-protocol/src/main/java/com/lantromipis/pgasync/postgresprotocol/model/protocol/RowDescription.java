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
public final class RowDescription implements BackendMessage {
    private List<FieldDescription> fieldDescriptions;

    @Override
    public byte getMessageMarker() {
        return PostgresProtocolGeneralConstants.ROW_DESCRIPTION_START_CHAR;
    }

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitRowDescription(this);
    }

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class FieldDescription {
        private String fieldName;
        private int tableOid;
        private short columnAttributeNumber;
        private int fieldDataTypeOid;
        private short fieldDataTypeSize;
        private int typeModifier;
        private short formatCode;
    }
}
