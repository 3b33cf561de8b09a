package com.lantromipis.pgasync.connection.testutils;

import com.lantromipis.pgasync.postgresprotocol.testutils.BackendMessages;
import com.lantromipis.pgasync.postgresprotocol.testutils.FrontendMessage;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Server side of an in-memory channel: reads what client wrote and answers with raw backend messages.
 */
public class EmbeddedPgServer {

    public static final int PROCESS_ID = 4242;
    public static final int SECRET_KEY = 777;

    private final EmbeddedChannel channel;

    public EmbeddedPgServer(EmbeddedChannel channel) {
        this.channel = channel;
    }

    public EmbeddedChannel getChannel() {
        return channel;
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    /**
     * Reads startup message written by client and answers that startup is completed.
     */
    public Map<String, String> acceptStartup() {
        Map<String, String> parameters = readStartupParameters();
        send(BackendMessages.startupCompleted(PROCESS_ID, SECRET_KEY));
        return parameters;
    }

    public Map<String, String> readStartupParameters() {
        ByteBuf written = readWritten();
        try {
            return FrontendMessage.readStartupParameters(written);
        } finally {
            written.release();
        }
    }

    public List<FrontendMessage> readMessages() {
        ByteBuf written = readWritten();
        try {
            return FrontendMessage.readAll(written);
        } finally {
            written.release();
        }
    }

    /**
     * @return tags of messages written since last read, e.g. {@code "PBDES"}
     */
    public String readTags() {
        return readMessages()
                .stream()
                .map(message -> String.valueOf(message.getTag()))
                .collect(Collectors.joining());
    }

    /**
     * @return raw bytes written since last read
     */
    public ByteBuf readWritten() {
        channel.runPendingTasks();
        ByteBuf ret = Unpooled.buffer();
        ByteBuf chunk;
        while ((chunk = channel.readOutbound()) != null) {
            ret.writeBytes(chunk);
            chunk.release();
        }
        return ret;
    }

    public void send(ByteBuf... messages) {
        channel.writeInbound(BackendMessages.concat(messages));
        channel.runPendingTasks();
    }

    /**
     * Sends messages as separate socket reads of at most {@code chunkSize} bytes, splitting messages at any byte.
     * Trailing {@code keepLastBytes} bytes are not sent.
     */
    public void sendInChunks(int chunkSize, int keepLastBytes, ByteBuf... messages) {
        ByteBuf whole = BackendMessages.concat(messages);
        try {
            while (whole.readableBytes() > keepLastBytes) {
                channel.writeInbound(whole.readRetainedSlice(Math.min(chunkSize, whole.readableBytes() - keepLastBytes)));
                channel.runPendingTasks();
            }
        } finally {
            whole.release();
        }
    }

    public void sendInChunks(int chunkSize, ByteBuf... messages) {
        sendInChunks(chunkSize, 0, messages);
    }

    /**
     * Answers simple query returning single text column.
     */
    public void answerSingleColumn(String column, String... values) {
        ByteBuf[] messages = new ByteBuf[values.length + 3];
        messages[0] = BackendMessages.rowDescription(column, BackendMessages.TEXT_OID);
        for (int i = 0; i < values.length; i++) {
            messages[i + 1] = BackendMessages.dataRow(values[i]);
        }
        messages[values.length + 1] = BackendMessages.commandComplete("SELECT " + values.length);
        messages[values.length + 2] = BackendMessages.readyForQuery();
        send(messages);
    }
}
