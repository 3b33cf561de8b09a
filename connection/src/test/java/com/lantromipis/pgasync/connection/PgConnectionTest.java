package com.lantromipis.pgasync.connection;

import com.lantromipis.pgasync.configuration.utils.PgAsyncConfigurationLoader;
import com.lantromipis.pgasync.connection.model.PgConnectionStatus;
import com.lantromipis.pgasync.connection.model.PgQueryState;
import com.lantromipis.pgasync.connection.model.PoolClientState;
import com.lantromipis.pgasync.connection.model.QueryType;
import com.lantromipis.pgasync.connection.testutils.EmbeddedChannelConnector;
import com.lantromipis.pgasync.connection.testutils.EmbeddedPgServer;
import com.lantromipis.pgasync.connection.testutils.RecordingConnectionListener;
import com.lantromipis.pgasync.connection.testutils.ScramServer;
import com.lantromipis.pgasync.postgresprotocol.exception.MessageDecodingException;
import com.lantromipis.pgasync.postgresprotocol.exception.PgAuthenticationException;
import com.lantromipis.pgasync.postgresprotocol.exception.PgConnectionException;
import com.lantromipis.pgasync.postgresprotocol.exception.PgServerErrorException;
import com.lantromipis.pgasync.postgresprotocol.model.PgRow;
import com.lantromipis.pgasync.postgresprotocol.testutils.FrontendMessage;
import com.lantromipis.pgasync.postgresprotocol.utils.PasswordUtils;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.lantromipis.pgasync.postgresprotocol.testutils.BackendMessages.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class PgConnectionTest {

    private EmbeddedChannelConnector connector;
    private RecordingConnectionListener listener;

    @BeforeEach
    void setUp() {
        connector = new EmbeddedChannelConnector();
        listener = new RecordingConnectionListener();
    }

    @Nested
    class Startup {

        @Test
        void shouldSendStartupParametersAndBecomeReady() {
            // given
            PgConnection connection = createConnection(Map.of(
                    "pg-async.connection.application-name", "billing",
                    "pg-async.connection.startup-parameters.search_path", "billing,public"
            ));

            // when
            connection.start();
            EmbeddedPgServer server = connector.getLastServer();
            Map<String, String> startupParameters = server.acceptStartup();

            // then
            assertThat(startupParameters).containsExactly(
                    Map.entry("user", "app"),
                    Map.entry("database", "orders"),
                    Map.entry("application_name", "billing"),
                    Map.entry("search_path", "billing,public")
            );
            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.OK);
            assertThat(connection.getQueryState()).isEqualTo(PgQueryState.READY);
            assertThat(connection.getPoolClientState()).isEqualTo(PoolClientState.READY);
            assertThat(connection.getServerParameters()).containsEntry("server_version", "16.1");
            assertThat(listener.getParameters()).containsEntry("client_encoding", "UTF8");
        }

        @Test
        void shouldNotAllowSecondStart() {
            // given
            PgConnection connection = createConnection();
            connection.start();

            // when / then
            assertThatThrownBy(connection::start).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void shouldAuthenticateWithCleartextPassword() {
            // given
            PgConnection connection = createConnection(Map.of("pg-async.connection.password", "secret"));
            connection.start();
            EmbeddedPgServer server = connector.getLastServer();
            server.readStartupParameters();

            // when
            server.send(authCleartextPassword());

            // then
            List<FrontendMessage> messages = server.readMessages();
            assertThat(messages).hasSize(1);
            assertThat(messages.get(0).getTag()).isEqualTo('p');
            assertThat(messages.get(0).firstString()).isEqualTo("secret");

            server.send(startupCompleted(1, 2));
            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.OK);
        }

        @Test
        void shouldAuthenticateWithMd5Password() {
            // given
            byte[] salt = new byte[]{9, 8, 7, 6};
            PgConnection connection = createConnection(Map.of("pg-async.connection.password", "secret"));
            connection.start();
            EmbeddedPgServer server = connector.getLastServer();
            server.readStartupParameters();

            // when
            server.send(authMd5Password(salt));

            // then
            List<FrontendMessage> messages = server.readMessages();
            assertThat(messages.get(0).getTag()).isEqualTo('p');
            assertThat(messages.get(0).firstString()).isEqualTo(PasswordUtils.encodeMd5Password("app", "secret", salt));

            server.send(startupCompleted(1, 2));
            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.OK);
        }

        @Test
        void shouldAuthenticateWithScramSha256() throws Exception {
            // given
            PgConnection connection = createConnection(Map.of("pg-async.connection.password", "pencil"));
            connection.start();
            EmbeddedPgServer server = connector.getLastServer();
            server.readStartupParameters();

            // when
            server.send(authSasl("SCRAM-SHA-256-PLUS", "SCRAM-SHA-256"));

            // then
            FrontendMessage initialResponse = server.readMessages().get(0);
            assertThat(initialResponse.getTag()).isEqualTo('p');
            assertThat(initialResponse.firstString()).isEqualTo("SCRAM-SHA-256");

            String clientFirstMessage = readSaslInitialResponseData(initialResponse);
            assertThat(clientFirstMessage).startsWith("n,,n=*,r=");
            String clientNonce = clientFirstMessage.substring("n,,n=*,r=".length());

            ScramServer scramServer = new ScramServer("pencil", clientNonce);
            server.send(authSaslContinue(scramServer.serverFirstMessage()));

            FrontendMessage response = server.readMessages().get(0);
            assertThat(response.getTag()).isEqualTo('p');
            assertThat(response.bodyAsString()).startsWith("c=biws,r=" + scramServer.serverNonce() + ",p=");

            server.send(
                    authSaslFinal("v=" + scramServer.serverSignature()),
                    startupCompleted(1, 2)
            );
            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.OK);
            assertThat(listener.getErrors()).isEmpty();
        }

        @Test
        void shouldFailWhenServerAsksForPasswordButNoneConfigured() {
            // given
            PgConnection connection = createConnection();

            StepVerifier.create(connection.query("SELECT 1"))
                    .then(() -> {
                        EmbeddedPgServer server = connector.getLastServer();
                        server.readStartupParameters();

                        // when
                        server.send(authCleartextPassword());
                    })
                    // then
                    .expectError(PgAuthenticationException.class)
                    .verify();

            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.CLOSED);
            assertThat(connector.getLastServer().isOpen()).isFalse();
            assertThat(listener.getErrors()).singleElement().isInstanceOf(PgAuthenticationException.class);
        }

        @Test
        void shouldFailQueuedCommandsWhenServerRejectsStartup() {
            // given
            PgConnection connection = createConnection(Map.of("pg-async.connection.password", "wrong"));

            StepVerifier.create(connection.query("SELECT 1"))
                    .then(() -> {
                        EmbeddedPgServer server = connector.getLastServer();
                        server.readStartupParameters();
                        server.send(authCleartextPassword());

                        // when
                        server.send(errorResponse("FATAL", "28P01", "password authentication failed for user \"app\""));
                    })
                    // then
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(PgConnectionException.class)
                            .hasMessageContaining("28P01")
                            .hasCauseInstanceOf(PgServerErrorException.class))
                    .verify();

            assertThat(listener.getErrors()).singleElement().isInstanceOf(PgServerErrorException.class);
            assertThat(listener.getClosedCount()).isEqualTo(1);
        }

        @Test
        void shouldRejectQueriesWhenServerIsUnreachable() {
            // given
            connector.setRefuseConnections(true);
            PgConnection connection = createConnection();

            // when / then
            StepVerifier.create(connection.query("SELECT 1"))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(PgConnectionException.class)
                            .hasMessageContaining("Failed to connect to 127.0.0.1:5432"))
                    .verify();

            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.BAD);
            assertThat(listener.getErrors()).hasSize(1);

            StepVerifier.create(connection.query("SELECT 2"))
                    .expectError(PgConnectionException.class)
                    .verify();
        }
    }

    @Nested
    class SimpleQuery {

        @Test
        void shouldReturnRowsWithBoolColumnsAsBoolean() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);

            // when / then
            StepVerifier.create(connection.query("SELECT true AS active, 'alice' AS name, NULL AS note"))
                    .then(() -> {
                        List<FrontendMessage> messages = server.readMessages();
                        assertThat(messages).hasSize(1);
                        assertThat(messages.get(0).getTag()).isEqualTo('Q');
                        assertThat(messages.get(0).firstString()).isEqualTo("SELECT true AS active, 'alice' AS name, NULL AS note");
                        assertThat(connection.getQueryType()).isEqualTo(QueryType.SIMPLE);

                        server.send(
                                rowDescription("active", BOOL_OID, "name", TEXT_OID, "note", TEXT_OID),
                                dataRow("t", "alice", null),
                                commandComplete("SELECT 1"),
                                readyForQuery()
                        );
                    })
                    .assertNext(row -> {
                        assertThat(row.getCellValueByName("active")).isEqualTo(Boolean.TRUE);
                        assertThat(row.getCellValueByNameAsString("name")).isEqualTo("alice");
                        assertThat(row.getCellValueByName("note")).isNull();
                        assertThat(row.getColumnNames()).containsExactly("active", "name", "note");
                    })
                    .verifyComplete();

            assertThat(connection.getQueryState()).isEqualTo(PgQueryState.READY);
            assertThat(connection.getQueryType()).isEqualTo(QueryType.NONE);
            assertThat(connection.getQueueCount()).isZero();
        }

        @Test
        void shouldKeepConnectionUsableAfterStatementError() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);

            // when
            StepVerifier.create(connection.query("SELEC 1"))
                    .then(() -> {
                        server.readMessages();
                        server.send(
                                errorResponse("ERROR", "42601", "syntax error at or near \"SELEC\""),
                                readyForQuery()
                        );
                    })
                    // then
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(PgServerErrorException.class);
                        PgServerErrorException serverError = (PgServerErrorException) error;
                        assertThat(serverError.getSqlState()).isEqualTo("42601");
                        assertThat(serverError.getQueryString()).isEqualTo("SELEC 1");
                        assertThat(serverError.getMessage()).isEqualTo("ERROR 42601: syntax error at or near \"SELEC\" in query: SELEC 1");
                    })
                    .verify();

            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.OK);
            assertThat(connection.getPoolClientState()).isEqualTo(PoolClientState.READY);
            assertThat(listener.getErrors()).isEmpty();

            StepVerifier.create(connection.query("SELECT 1 AS one"))
                    .then(() -> {
                        server.readMessages();
                        server.answerSingleColumn("one", "1");
                    })
                    .assertNext(row -> assertThat(row.getCellValueByNameAsString("one")).isEqualTo("1"))
                    .verifyComplete();
        }

        @Test
        void shouldCompleteEmptyQueryWithoutRows() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);

            // when / then
            StepVerifier.create(connection.query(""))
                    .then(() -> server.send(emptyQueryResponse(), readyForQuery()))
                    .verifyComplete();
        }

        @Test
        void shouldSkipUnknownMessages() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);
            ByteBuf unknownBody = Unpooled.buffer();
            unknownBody.writeInt(12345);

            // when / then
            StepVerifier.create(connection.query("SELECT 'x' AS v"))
                    .then(() -> server.send(
                            rowDescription("v", TEXT_OID),
                            message('W', unknownBody),
                            dataRow("x"),
                            commandComplete("SELECT 1"),
                            readyForQuery()
                    ))
                    .assertNext(row -> assertThat(row.getCellValueByIdxAsString(0)).isEqualTo("x"))
                    .verifyComplete();
            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.OK);
        }

        @Test
        void shouldTrackTransactionStatus() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);

            // when
            StepVerifier.create(connection.query("BEGIN"))
                    .then(() -> server.send(commandComplete("BEGIN"), readyForQuery('T')))
                    .verifyComplete();

            // then
            assertThat(connection.getBackendTransactionStatus()).isEqualTo('T');
        }

        @Test
        void shouldReportNoticesAndParameterChanges() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);

            // when
            StepVerifier.create(connection.query("SET TIME ZONE 'UTC'"))
                    .then(() -> server.send(
                            noticeResponse("WARNING", "there is no transaction in progress"),
                            parameterStatus("TimeZone", "UTC"),
                            commandComplete("SET"),
                            readyForQuery()
                    ))
                    .verifyComplete();

            // then
            assertThat(listener.getNotices()).singleElement()
                    .satisfies(notice -> assertThat(notice.getMessage()).isEqualTo("there is no transaction in progress"));
            assertThat(listener.getParameters()).containsEntry("TimeZone", "UTC");
            assertThat(connection.getServerParameters()).containsEntry("TimeZone", "UTC");
        }
    }

    @Nested
    class Queueing {

        @Test
        void shouldWriteCommandsOneByOneInSubmissionOrder() {
            // given
            PgConnection connection = createConnection();
            CompletableFuture<List<PgRow>> first = connection.query("SELECT 'first' AS v").collectList().toFuture();
            CompletableFuture<List<PgRow>> second = connection.query("SELECT 'second' AS v").collectList().toFuture();
            CompletableFuture<List<PgRow>> third = connection.query("SELECT 'third' AS v").collectList().toFuture();
            EmbeddedPgServer server = connector.getLastServer();

            // when
            server.acceptStartup();

            // then
            assertThat(connector.getServers()).hasSize(1);
            assertThat(server.readMessages()).singleElement()
                    .satisfies(message -> assertThat(message.firstString()).isEqualTo("SELECT 'first' AS v"));
            assertThat(connection.getBacklogLength()).isEqualTo(2);
            assertThat(connection.getQueueCount()).isEqualTo(3);

            server.answerSingleColumn("v", "first");
            assertThat(first).isCompleted();
            assertThat(second).isNotDone();
            assertThat(server.readMessages()).singleElement()
                    .satisfies(message -> assertThat(message.firstString()).isEqualTo("SELECT 'second' AS v"));
            assertThat(connection.getBacklogLength()).isEqualTo(1);

            server.answerSingleColumn("v", "second");
            assertThat(server.readMessages()).singleElement()
                    .satisfies(message -> assertThat(message.firstString()).isEqualTo("SELECT 'third' AS v"));
            server.answerSingleColumn("v", "third");

            assertThat(first.join()).extracting(row -> row.getCellValueByNameAsString("v")).containsExactly("first");
            assertThat(second.join()).extracting(row -> row.getCellValueByNameAsString("v")).containsExactly("second");
            assertThat(third.join()).extracting(row -> row.getCellValueByNameAsString("v")).containsExactly("third");
            assertThat(connection.getBacklogLength()).isZero();
            assertThat(connection.getQueueCount()).isZero();
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 3, 7, 64})
        void shouldKeepOrderWhenResponsesArriveInFragments(int chunkSize) {
            // given
            PgConnection connection = createConnection();
            CompletableFuture<List<PgRow>> first = connection.query("SELECT id, active FROM users").collectList().toFuture();
            CompletableFuture<List<PgRow>> second = connection.query("SELECT 'second' AS v").collectList().toFuture();
            CompletableFuture<List<PgRow>> third = connection.query("UPDATE users SET active = false").collectList().toFuture();
            EmbeddedPgServer server = connector.getLastServer();
            server.readStartupParameters();

            // when
            server.sendInChunks(chunkSize, startupCompleted(EmbeddedPgServer.PROCESS_ID, EmbeddedPgServer.SECRET_KEY));
            assertThat(server.readMessages()).singleElement()
                    .satisfies(message -> assertThat(message.firstString()).isEqualTo("SELECT id, active FROM users"));
            assertThat(connection.getBacklogLength()).isEqualTo(2);

            server.sendInChunks(
                    chunkSize,
                    1,
                    rowDescription("id", TEXT_OID, "active", BOOL_OID),
                    dataRow("1", "t"),
                    dataRow("2", "f"),
                    commandComplete("SELECT 2"),
                    readyForQuery()
            );
            assertThat(server.readTags()).isEmpty();
            assertThat(connection.getBacklogLength()).isEqualTo(2);

            server.send(Unpooled.wrappedBuffer(new byte[]{'I'}));
            assertThat(server.readMessages()).singleElement()
                    .satisfies(message -> assertThat(message.firstString()).isEqualTo("SELECT 'second' AS v"));
            assertThat(connection.getBacklogLength()).isEqualTo(1);

            server.sendInChunks(
                    chunkSize,
                    rowDescription("v", TEXT_OID),
                    dataRow("second"),
                    commandComplete("SELECT 1"),
                    readyForQuery()
            );
            assertThat(server.readMessages()).singleElement()
                    .satisfies(message -> assertThat(message.firstString()).isEqualTo("UPDATE users SET active = false"));
            assertThat(connection.getBacklogLength()).isZero();

            server.sendInChunks(chunkSize, commandComplete("UPDATE 2"), readyForQuery());

            // then
            assertThat(first.join())
                    .extracting(row -> row.getCellValueByNameAsString("id"), row -> row.getCellValueByName("active"))
                    .containsExactly(tuple("1", true), tuple("2", false));
            assertThat(second.join()).extracting(row -> row.getCellValueByNameAsString("v")).containsExactly("second");
            assertThat(third.join()).isEmpty();
            assertThat(connection.getQueueCount()).isZero();
            assertThat(connection.getQueryState()).isEqualTo(PgQueryState.READY);
            assertThat(server.readTags()).isEmpty();
        }

        @Test
        void shouldReportPoolStateTransitions() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);

            // when
            StepVerifier.create(connection.query("SELECT 1 AS one"))
                    .then(() -> server.answerSingleColumn("one", "1"))
                    .expectNextCount(1)
                    .verifyComplete();
            connection.disconnect();

            // then
            assertThat(listener.getStates()).containsExactly(
                    PoolClientState.READY,
                    PoolClientState.BUSY,
                    PoolClientState.READY,
                    PoolClientState.CLOSING
            );
            assertThat(listener.getQueueCounts()).containsExactly(1, 0);
            assertThat(listener.getClosedCount()).isEqualTo(1);
        }

        @Test
        void shouldSendCancelRequestOnSeparateChannelWhenRunningCommandIsUnsubscribed() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);
            Disposable subscription = connection.query("SELECT pg_sleep(60)").subscribe();
            assertThat(server.readTags()).isEqualTo("Q");

            // when
            subscription.dispose();

            // then
            assertThat(connector.getServers()).hasSize(2);
            EmbeddedPgServer cancelChannel = connector.getServer(1);
            ByteBuf cancelRequest = cancelChannel.readWritten();
            assertThat(cancelRequest.readableBytes()).isEqualTo(16);
            assertThat(cancelRequest.readInt()).isEqualTo(16);
            assertThat(cancelRequest.readInt()).isEqualTo(80877102);
            assertThat(cancelRequest.readInt()).isEqualTo(EmbeddedPgServer.PROCESS_ID);
            assertThat(cancelRequest.readInt()).isEqualTo(EmbeddedPgServer.SECRET_KEY);
            cancelRequest.release();
            assertThat(cancelChannel.isOpen()).isFalse();
            assertThat(connection.getQueueCount()).isZero();

            server.send(
                    errorResponse("ERROR", "57014", "canceling statement due to user request"),
                    readyForQuery()
            );
            assertThat(connection.getPoolClientState()).isEqualTo(PoolClientState.READY);
            assertThat(listener.getErrors()).isEmpty();
        }

        @Test
        void shouldDropNotWrittenCommandWhenUnsubscribed() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);
            CompletableFuture<List<PgRow>> running = connection.query("SELECT 'a' AS v").collectList().toFuture();
            Disposable queued = connection.query("SELECT 'b' AS v").subscribe();
            server.readMessages();
            assertThat(connection.getBacklogLength()).isEqualTo(1);

            // when
            queued.dispose();

            // then
            assertThat(connection.getBacklogLength()).isZero();
            assertThat(connector.getServers()).hasSize(1);

            server.answerSingleColumn("v", "a");
            assertThat(running).isCompleted();
            assertThat(server.readMessages()).isEmpty();
        }

        @Test
        void shouldTerminateAfterQueueIsDrainedWhenAutoDisconnectIsEnabled() {
            // given
            PgConnection connection = createConnection(Map.of("pg-async.connection.auto-disconnect", "true"));

            // when
            StepVerifier.create(connection.query("SELECT 1 AS one"))
                    .then(() -> {
                        EmbeddedPgServer server = connector.getLastServer();
                        server.acceptStartup();
                        assertThat(server.readTags()).isEqualTo("Q");
                        server.answerSingleColumn("one", "1");
                    })
                    .expectNextCount(1)
                    .verifyComplete();

            // then
            EmbeddedPgServer server = connector.getLastServer();
            assertThat(server.readTags()).isEqualTo("X");
            assertThat(server.isOpen()).isFalse();
            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.CLOSED);
        }

        @Test
        void shouldFailCommandsSubmittedAfterDisconnect() {
            // given
            PgConnection connection = createConnection();
            startConnection(connection);
            connection.disconnect();

            // when / then
            StepVerifier.create(connection.query("SELECT 1"))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(PgConnectionException.class)
                            .hasMessageStartingWith("Connection failed"))
                    .verify();
        }

        @Test
        void shouldCloseWithoutConnectingWhenDisconnectedBeforeStart() {
            // given
            PgConnection connection = createConnection();

            // when
            connection.disconnect();

            // then
            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.CLOSED);
            assertThat(connector.getServers()).isEmpty();
            assertThat(listener.getClosedCount()).isEqualTo(1);
        }
    }

    @Nested
    class ConnectionFailures {

        @Test
        void shouldFailEverythingWhenDataRowDoesNotMatchRowDescription() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);
            CompletableFuture<List<PgRow>> running = connection.query("SELECT 2").collectList().toFuture();

            // when / then
            StepVerifier.create(connection.query("SELECT 1"))
                    .then(() -> {
                        CompletableFuture<List<PgRow>> next = connection.query("SELECT 3").collectList().toFuture();
                        server.send(
                                rowDescription("v", TEXT_OID),
                                dataRow("1", "2"),
                                commandComplete("SELECT 1"),
                                readyForQuery()
                        );
                        assertThat(next).isCompletedExceptionally();
                    })
                    .expectError(MessageDecodingException.class)
                    .verify();

            assertThat(running).isCompletedExceptionally();
            assertThat(server.isOpen()).isFalse();
            assertThat(connection.getConnectionStatus()).isEqualTo(PgConnectionStatus.CLOSED);
            assertThat(listener.getErrors()).singleElement().isInstanceOf(MessageDecodingException.class);
        }

        @Test
        void shouldFailRunningAndQueuedCommandsOnFatalError() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);
            CompletableFuture<List<PgRow>> running = connection.query("SELECT pg_sleep(60)").collectList().toFuture();
            CompletableFuture<List<PgRow>> queued = connection.query("SELECT 1").collectList().toFuture();

            // when
            server.send(errorResponse("FATAL", "57P01", "terminating connection due to administrator command"));

            // then
            assertThatThrownBy(running::join).hasCauseInstanceOf(PgServerErrorException.class);
            assertThatThrownBy(queued::join)
                    .hasCauseInstanceOf(PgConnectionException.class)
                    .hasMessageContaining("57P01");
            assertThat(server.isOpen()).isFalse();
            assertThat(listener.getErrors()).singleElement().isInstanceOf(PgServerErrorException.class);
            assertThat(listener.getClosedCount()).isEqualTo(1);
        }

        @Test
        void shouldFailRunningCommandWhenChannelIsClosed() {
            // given
            PgConnection connection = createConnection();
            EmbeddedPgServer server = startConnection(connection);
            CompletableFuture<List<PgRow>> running = connection.query("SELECT 1").collectList().toFuture();

            // when
            server.getChannel().close();

            // then
            assertThatThrownBy(running::join)
                    .hasCauseInstanceOf(PgConnectionException.class)
                    .hasMessageContaining("Connection closed");
            assertThat(connection.getPoolClientState()).isEqualTo(PoolClientState.CLOSING);
        }
    }

    private PgConnection createConnection() {
        return createConnection(Map.of());
    }

    private PgConnection createConnection(Map<String, String> extraProperties) {
        Map<String, String> properties = new HashMap<>();
        properties.put("pg-async.connection.user", "app");
        properties.put("pg-async.connection.database", "orders");
        properties.putAll(extraProperties);

        PgConnection connection = new PgConnection(PgAsyncConfigurationLoader.loadConnectionProperties(properties), connector);
        connection.addListener(listener);
        return connection;
    }

    private EmbeddedPgServer startConnection(PgConnection connection) {
        connection.start();
        EmbeddedPgServer server = connector.getLastServer();
        server.acceptStartup();
        return server;
    }

    private static String readSaslInitialResponseData(FrontendMessage message) {
        ByteBuf body = Unpooled.wrappedBuffer(message.getBody());
        body.skipBytes(body.bytesBefore((byte) 0) + 1);
        int length = body.readInt();
        return body.readCharSequence(length, StandardCharsets.UTF_8).toString();
    }
}
