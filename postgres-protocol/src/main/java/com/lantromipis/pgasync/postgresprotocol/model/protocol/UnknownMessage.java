package com.lantromipis.pgasync.postgresprotocol.model.protocol;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Message with start byte this client does not decode. Its body is skipped using declared length.
 */
@Data
@AllArgsConstructor
public final class UnknownMessage implements BackendMessage {
    private byte messageMarker;
    private int length;

    @Override
    public void accept(BackendMessageVisitor visitor) {
        visitor.visitUnknownMessage(this);
    }
}
