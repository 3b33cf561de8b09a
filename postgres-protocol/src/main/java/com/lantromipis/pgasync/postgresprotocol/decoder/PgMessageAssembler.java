package com.lantromipis.pgasync.postgresprotocol.decoder;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.lantromipis.pgasync.postgresprotocol.exception.MessageDecodingException;
import com.lantromipis.pgasync.postgresprotocol.model.protocol.BackendMessage;
import com.lantromipis.pgasync.postgresprotocol.utils.DecoderUtils;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import java.util.function.Consumer;

/**
 * Reassembles server messages from arbitrary chunks. Message which is not fully received is kept in this object
 * between calls of {@link #feed(ByteBuf, Consumer)}. Every complete message is decoded and passed to consumer before
 * next bytes are read, so messages are dispatched in arrival order.
 * <p>
 * Not thread safe, must be used from one thread (channel event loop).
 */
public class PgMessageAssembler {

    private static final int NO_MESSAGE_IN_PROGRESS = -1;

    private final ByteBufAllocator allocator;
    private final ByteBuf header;

    private byte messageMarker;
    private int expectedBodyLength = NO_MESSAGE_IN_PROGRESS;
    private ByteBuf body;

    public PgMessageAssembler(ByteBufAllocator allocator) {
        this.allocator = allocator;
        this.header = allocator.heapBuffer(
                PostgresProtocolGeneralConstants.MESSAGE_MARKER_AND_LENGTH_BYTES_COUNT,
                PostgresProtocolGeneralConstants.MESSAGE_MARKER_AND_LENGTH_BYTES_COUNT
        );
    }

    /**
     * Reads all readable bytes of chunk. Does not release chunk.
     */
    public void feed(ByteBuf chunk, Consumer<BackendMessage> consumer) {
        while (chunk.isReadable()) {
            if (expectedBodyLength == NO_MESSAGE_IN_PROGRESS) {
                if (!DecoderUtils.readFromBufUntilFilled(header, chunk, PostgresProtocolGeneralConstants.MESSAGE_MARKER_AND_LENGTH_BYTES_COUNT)) {
                    return;
                }

                messageMarker = header.readByte();
                int length = header.readInt();
                header.clear();

                if (length < PostgresProtocolGeneralConstants.MESSAGE_LENGTH_BYTES_COUNT) {
                    throw new MessageDecodingException("Invalid length " + length + " of message with start char '" + (char) messageMarker + "'");
                }

                expectedBodyLength = length - PostgresProtocolGeneralConstants.MESSAGE_LENGTH_BYTES_COUNT;
            }

            BackendMessage message;

            if (body == null && chunk.readableBytes() >= expectedBodyLength) {
                // whole body is in this chunk, no copy needed
                ByteBuf slice = chunk.readSlice(expectedBodyLength);
                byte marker = messageMarker;
                expectedBodyLength = NO_MESSAGE_IN_PROGRESS;
                message = ServerPostgresProtocolMessageDecoder.decode(marker, slice);
            } else {
                if (body == null) {
                    body = allocator.buffer(expectedBodyLength);
                }
                if (!DecoderUtils.readFromBufUntilFilled(body, chunk, expectedBodyLength)) {
                    return;
                }

                ByteBuf completeBody = body;
                byte marker = messageMarker;
                body = null;
                expectedBodyLength = NO_MESSAGE_IN_PROGRESS;
                try {
                    message = ServerPostgresProtocolMessageDecoder.decode(marker, completeBody);
                } finally {
                    completeBody.release();
                }
            }

            consumer.accept(message);
        }
    }

    public boolean hasIncompleteMessage() {
        return expectedBodyLength != NO_MESSAGE_IN_PROGRESS || header.isReadable();
    }

    public void release() {
        if (body != null) {
            body.release();
            body = null;
        }
        if (header.refCnt() > 0) {
            header.release();
        }
        expectedBodyLength = NO_MESSAGE_IN_PROGRESS;
    }
}
