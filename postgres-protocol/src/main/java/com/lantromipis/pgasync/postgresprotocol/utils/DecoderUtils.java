package com.lantromipis.pgasync.postgresprotocol.utils;

import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.lantromipis.pgasync.postgresprotocol.exception.MessageDecodingException;
import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

public class DecoderUtils {

    public static String readNextNullTerminatedString(ByteBuf byteBuf) {
        int length = byteBuf.bytesBefore(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        if (length < 0) {
            throw new MessageDecodingException("Expected null terminated string, but no delimiter found.");
        }

        String ret = byteBuf.toString(byteBuf.readerIndex(), length, StandardCharsets.UTF_8);
        byteBuf.skipBytes(length + 1);

        return ret;
    }

    public static String readRemainingAsString(ByteBuf byteBuf) {
        String ret = byteBuf.toString(StandardCharsets.UTF_8);
        byteBuf.skipBytes(byteBuf.readableBytes());

        return ret;
    }

    /**
     * Copies bytes from src to dest until dest contains requiredBytes readable bytes or src is exhausted.
     *
     * @return true if dest is filled
     */
    public static boolean readFromBufUntilFilled(ByteBuf dest, ByteBuf src, int requiredBytes) {
        int alreadyRead = dest.readableBytes();
        if (alreadyRead >= requiredBytes) {
            return true;
        }

        int canRead = src.readableBytes();
        int needToRead = requiredBytes - alreadyRead;
        int willRead = Math.min(needToRead, canRead);

        dest.writeBytes(src, willRead);

        return dest.readableBytes() >= requiredBytes;
    }

    private DecoderUtils() {
    }
}
