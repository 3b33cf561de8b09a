package com.lantromipis.pgasync.connection;

import com.lantromipis.pgasync.configuration.properties.PgConnectionProperties;
import com.lantromipis.pgasync.connection.api.PgConnectionEventListener;
import com.lantromipis.pgasync.connection.handler.PgCancelRequestChannelHandler;
import com.lantromipis.pgasync.connection.handler.PgConnectionChannelHandler;
import com.lantromipis.pgasync.connection.model.PgConnectionStatus;
import com.lantromipis.pgasync.connection.model.PgQueryState;
import com.lantromipis.pgasync.connection.model.PoolClientState;
import com.lantromipis.pgasync.connection.model.QueryType;
import com.lantromipis.pgasync.connection.statement.PreparedStatementCache;
import com.lantromipis.pgasync.connection.transport.PgChannelConnector;
import com.lantromipis.pgasync.connection.utils.PgChannelUtils;
import com.lantromipis.pgasync.postgresprotocol.auth.ScramSha256Authenticator;
import com.lantromipis.pgasync.postgresprotocol.command.*;
import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolErrorAndNoticeConstant;
import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.lantromipis.pgasync.postgresprotocol.constant.PostgresProtocolScramConstants;
import com.lantromipis.pgasync.postgresprotocol.decoder.PgMessageAssembler;
import com.lantromipis.pgasync.postgresprotocol.exception.PgAuthenticationException;
import com.lantromipis.pgasync.postgresprotocol.exception.PgConnectionException;
import com.lantromipis.pgasync.postgresprotocol.exception.PgServerErrorException;
import com.lantromipis.pgasync.postgresprotocol.model.PgRow;
import com.lantromipis.pgasync.postgresprotocol.model.protocol.*;
import com.lantromipis.pgasync.postgresprotocol.utils.PasswordUtils;
import com.lantromipis.pgasync.postgresprotocol.utils.PgRowMaterializer;
import com.lantromipis.pgasync.postgresprotocol.utils.PostgresErrorMessageUtils;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.util.concurrent.EventExecutor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Single asynchronous connection to Postgres.
 * <p>
 * All state is mutated on one event executor. Channel callbacks run on it because channel is registered on it, public
 * methods called from other threads are submitted to it. Commands are written strictly in submission order, and a
 * command which waits for complete blocks the queue until server sends ReadyForQuery.
 */
@Slf4j
public class PgConnection implements BackendMessageVisitor {

    private static final String UNNAMED = "";

    private final PgConnectionProperties properties;
    private final PgChannelConnector connector;
    private final EventExecutor executor;
    private final PreparedStatementCache statementCache;

    private final List<PgConnectionEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, String> serverParameters = new ConcurrentHashMap<>();
    private final AtomicBoolean startRequested = new AtomicBoolean(false);

    private final Deque<PgCommand> commandQueue = new ArrayDeque<>();
    private PgCommand currentCommand;
    private RowDescription currentRowDescription;
    private Channel channel;
    private PgMessageAssembler messageAssembler;
    private ScramSha256Authenticator scramAuthenticator;
    private BackendKeyData backendKeyData;
    private boolean readingChannel;

    private volatile PgConnectionStatus connectionStatus = PgConnectionStatus.NEEDED;
    private volatile PgQueryState queryState = PgQueryState.IDLE;
    private volatile PoolClientState poolClientState = PoolClientState.NOT_READY;
    private volatile QueryType queryType = QueryType.NONE;
    private volatile char backendTransactionStatus = (char) PostgresProtocolGeneralConstants.READY_FOR_QUERY_TRANSACTION_IDLE;
    private volatile Throwable lastError;
    private volatile int backlogLength;
    private volatile int queueCount;

    public PgConnection(final PgConnectionProperties properties, final PgChannelConnector connector) {
        this.properties = properties;
        this.connector = connector;
        this.executor = connector.nextExecutor();
        this.statementCache = properties.preparedStatementCacheSize() > 0
                ? new PreparedStatementCache(properties.preparedStatementCacheSize())
                : null;
    }

    public void addListener(PgConnectionEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PgConnectionEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts connecting. Result streams start connection on first subscription, so calling this is optional.
     *
     * @throws IllegalStateException if connection was already started
     */
    public void start() {
        if (!PgConnectionStatus.NEEDED.equals(connectionStatus) || !startRequested.compareAndSet(false, true)) {
            throw new IllegalStateException("Connection not in startable state. Status " + connectionStatus);
        }

        runInEventLoop(this::doStart);
    }

    /**
     * Executes simple query. Stream is cold: every subscription executes query again.
     */
    public Flux<PgRow> query(String sql) {
        return Flux.create(sink -> runInEventLoop(() -> {
            if (!prepareForSubscription(sink)) {
                return;
            }

            Query query = new Query(sql, new FluxSinkCommandObserver(sink));
            submit(sink, List.of(query), query);
        }));
    }

    /**
     * Executes statement with positional parameters ({@code $1}, {@code $2}, ...) using extended query protocol.
     * Parameters are sent in text format, null is SQL NULL.
     */
    public Flux<PgRow> executeStatement(String sql, List<?> parameters) {
        return Flux.create(sink -> runInEventLoop(() -> {
            if (!prepareForSubscription(sink)) {
                return;
            }

            List<PgCommand> commands = new ArrayList<>();

            String statementName = UNNAMED;
            if (statementCache != null) {
                statementName = statementCache.get(sql);
                if (statementName == null) {
                    statementName = statementCache.register(sql);
                    for (String evicted : statementCache.drainEvictedStatementNames()) {
                        commands.add(new Close(PostgresProtocolGeneralConstants.STATEMENT_TARGET, evicted));
                    }
                    commands.add(new Parse(statementName, sql));
                }
            } else {
                commands.add(new Parse(UNNAMED, sql));
            }

            commands.add(new Bind(UNNAMED, statementName, parameters));
            commands.add(new Describe(PostgresProtocolGeneralConstants.PORTAL_TARGET, UNNAMED));
            commands.add(new Execute(UNNAMED, 0));

            Sync sync = new Sync(sql, new StatementObserver(sink, sql, statementName));
            commands.add(sync);

            submit(sink, commands, sync);
        }));
    }

    public Flux<PgRow> executeStatement(String sql) {
        return executeStatement(sql, List.of());
    }

    public Mono<List<PgRow>> executeStatementForList(String sql, List<?> parameters) {
        return executeStatement(sql, parameters).collectList();
    }

    /**
     * Sends Terminate after all already queued commands and closes channel.
     */
    public void disconnect() {
        runInEventLoop(() -> {
            if (channel == null) {
                if (PgConnectionStatus.NEEDED.equals(connectionStatus)) {
                    startRequested.set(true);
                    setConnectionStatus(PgConnectionStatus.CLOSED);
                    failAllCommandsWith(new PgConnectionException("Connection closed"));
                    notifyListeners(listener -> listener.closed(this));
                    return;
                }
                if (!PgConnectionStatus.STARTED.equals(connectionStatus)) {
                    return;
                }
            } else if (PgConnectionStatus.CLOSED.equals(connectionStatus)) {
                return;
            }

            commandQueue.add(Terminate.INSTANCE);
            processQueue();
        });
    }

    public int getBacklogLength() {
        return backlogLength;
    }

    public int getQueueCount() {
        return queueCount;
    }

    public PgConnectionStatus getConnectionStatus() {
        return connectionStatus;
    }

    public PgQueryState getQueryState() {
        return queryState;
    }

    public PoolClientState getPoolClientState() {
        return poolClientState;
    }

    public QueryType getQueryType() {
        return queryType;
    }

    /**
     * @return transaction status from last ReadyForQuery: I (idle), T (in transaction) or E (failed transaction)
     */
    public char getBackendTransactionStatus() {
        return backendTransactionStatus;
    }

    public Map<String, String> getServerParameters() {
        return Collections.unmodifiableMap(serverParameters);
    }

    public Throwable getLastError() {
        return lastError;
    }

    public EventExecutor getExecutor() {
        return executor;
    }

    // channel callbacks, called on executor

    public void onChannelRead(ByteBuf message) {
        readingChannel = true;
        try {
            if (messageAssembler != null) {
                messageAssembler.feed(message, this::dispatch);
            }
        } catch (Exception e) {
            failConnection(e);
        } finally {
            readingChannel = false;
            message.release();
            if (PgConnectionStatus.CLOSED.equals(connectionStatus)) {
                releaseMessageAssembler();
            }
        }
    }

    public void onChannelInactive() {
        // channel may be closed while assembler is still dispatching current chunk
        if (!readingChannel) {
            releaseMessageAssembler();
        }

        if (PgConnectionStatus.CLOSED.equals(connectionStatus)) {
            return;
        }

        log.debug("Postgres connection closed");
        setConnectionStatus(PgConnectionStatus.CLOSED);
        failAllCommandsWith(new PgConnectionException("Connection closed", lastError));
        notifyListeners(listener -> listener.closed(this));
    }

    public void onTransportError(Throwable cause) {
        failConnection(new PgConnectionException("Transport error. ", cause));
    }

    // message handling

    private void dispatch(BackendMessage message) {
        if (PgConnectionStatus.BAD.equals(connectionStatus) || PgConnectionStatus.CLOSED.equals(connectionStatus)) {
            log.debug("Ignoring message '{}' received by failed connection", (char) message.getMessageMarker());
            return;
        }
        log.trace("Handling message '{}'", (char) message.getMessageMarker());
        message.accept(this);
    }

    @Override
    public void visitAuthenticationRequest(AuthenticationRequest message) {
        switch (message.getMethod()) {
            case OK -> {
                log.debug("Authenticated as {}", properties.user());
                setConnectionStatus(PgConnectionStatus.AUTH_OK);
            }
            case CLEARTEXT_PASSWORD -> writeAndFlush(new PasswordMessage(requirePassword()));
            case MD5_PASSWORD -> writeAndFlush(
                    new PasswordMessage(PasswordUtils.encodeMd5Password(properties.user(), requirePassword(), message.getSalt()))
            );
            case SASL -> {
                List<String> mechanisms = message.getSaslMechanisms();
                if (mechanisms == null || !mechanisms.contains(PostgresProtocolScramConstants.SASL_SHA_256_AUTH_MECHANISM_NAME)) {
                    throw new PgAuthenticationException("Unsupported SASL mechanisms " + mechanisms);
                }
                scramAuthenticator = new ScramSha256Authenticator(requirePassword());
                writeAndFlush(new SaslInitialResponse(
                        PostgresProtocolScramConstants.SASL_SHA_256_AUTH_MECHANISM_NAME,
                        scramAuthenticator.createClientFirstMessage()
                ));
            }
            case SASL_CONTINUE -> writeAndFlush(new SaslResponse(requireScramAuthenticator().handleServerFirstMessage(message.getSaslData())));
            case SASL_FINAL -> requireScramAuthenticator().handleServerFinalMessage(message.getSaslData());
            default -> throw new PgAuthenticationException(
                    "Unsupported authentication method " + message.getMethod() + " (code " + message.getMethodMarker() + ")"
            );
        }
    }

    @Override
    public void visitBackendKeyData(BackendKeyData message) {
        backendKeyData = message;
    }

    @Override
    public void visitParameterStatus(ParameterStatus message) {
        log.debug("Server parameter {}: {}", message.getParameterName(), message.getParameterValue());
        serverParameters.put(message.getParameterName(), message.getParameterValue());
        notifyListeners(listener -> listener.parameterStatus(this, message.getParameterName(), message.getParameterValue()));
    }

    @Override
    public void visitRowDescription(RowDescription message) {
        currentRowDescription = message;
    }

    @Override
    public void visitDataRow(DataRow message) {
        if (PgQueryState.BUSY.equals(queryState) && currentCommand != null) {
            currentCommand.next(PgRowMaterializer.materialize(currentRowDescription, message));
        } else {
            log.debug("Ignoring data row received without current command");
        }
    }

    @Override
    public void visitCommandComplete(CommandComplete message) {
        log.debug("Command complete: {}", message.getCommandTag());
        completeCurrentCommand();
    }

    @Override
    public void visitReadyForQuery(ReadyForQuery message) {
        backendTransactionStatus = message.getTransactionStatus();
        setConnectionStatus(PgConnectionStatus.OK);
        setQueryState(PgQueryState.READY);

        // statement may end without CommandComplete, e.g. after PortalSuspended
        completeCurrentCommand();
        queryType = QueryType.NONE;

        processQueue();
    }

    @Override
    public void visitErrorResponse(ErrorResponse message) {
        String queryString = currentCommand == null ? null : currentCommand.getDescription();
        PgServerErrorException exception = new PgServerErrorException(message, queryString);
        lastError = exception;

        boolean fatal = PostgresProtocolErrorAndNoticeConstant.FATAL_SEVERITY.equals(message.getSeverity())
                || PostgresProtocolErrorAndNoticeConstant.PANIC_SEVERITY.equals(message.getSeverity());
        boolean duringStartup = PgConnectionStatus.MADE.equals(connectionStatus)
                || PgConnectionStatus.AUTH_OK.equals(connectionStatus);

        if (currentCommand != null) {
            PgCommand command = currentCommand;
            currentCommand = null;
            command.error(exception);
        }

        if (fatal || duringStartup) {
            log.error("Postgres connection failed: {}", exception.getMessage());
            setConnectionStatus(PgConnectionStatus.BAD);
            notifyListeners(listener -> listener.error(this, exception));
            processQueue();
        } else {
            log.debug("Postgres error: {}", exception.getMessage());
        }
    }

    @Override
    public void visitNoticeResponse(NoticeResponse message) {
        if (PostgresProtocolErrorAndNoticeConstant.WARNING_SEVERITY.equals(message.getSeverity())) {
            log.warn("Postgres notice: {}", PostgresErrorMessageUtils.getLoggableErrorMessageFromErrorResponse(message));
        } else {
            log.debug("Postgres notice: {}", PostgresErrorMessageUtils.getLoggableErrorMessageFromErrorResponse(message));
        }
        notifyListeners(listener -> listener.notice(this, message));
    }

    @Override
    public void visitEmptyQueryResponse(EmptyQueryResponse message) {
        completeCurrentCommand();
    }

    @Override
    public void visitParseComplete(ParseComplete message) {
        log.trace("Parse complete");
    }

    @Override
    public void visitBindComplete(BindComplete message) {
        log.trace("Bind complete");
    }

    @Override
    public void visitCloseComplete(CloseComplete message) {
        log.trace("Close complete");
    }

    @Override
    public void visitNoData(NoData message) {
        currentRowDescription = null;
    }

    @Override
    public void visitParameterDescription(ParameterDescription message) {
        log.trace("Statement parameter types {}", message.getParameterTypeOids());
    }

    @Override
    public void visitPortalSuspended(PortalSuspended message) {
        log.debug("Portal suspended");
    }

    @Override
    public void visitCopyInResponse(CopyInResponse message) {
        log.warn("COPY FROM STDIN is not supported");
        setQueryState(PgQueryState.COPY_IN);
    }

    @Override
    public void visitCopyOutResponse(CopyOutResponse message) {
        log.warn("COPY TO STDOUT is not supported");
        setQueryState(PgQueryState.COPY_OUT);
    }

    @Override
    public void visitUnknownMessage(UnknownMessage message) {
        log.warn("Skipping unknown message with start char '{}' and length {}", (char) message.getMessageMarker(), message.getLength());
    }

    // queue

    private boolean prepareForSubscription(FluxSink<PgRow> sink) {
        if (PgConnectionStatus.NEEDED.equals(connectionStatus) && startRequested.compareAndSet(false, true)) {
            doStart();
        }

        if (PgConnectionStatus.BAD.equals(connectionStatus) || PgConnectionStatus.CLOSED.equals(connectionStatus)) {
            sink.error(new PgConnectionException("Connection failed: " + describeLastError(), lastError));
            return false;
        }

        return true;
    }

    private void submit(FluxSink<PgRow> sink, List<PgCommand> commands, PgCommand observedCommand) {
        commandQueue.addAll(commands);
        changeQueueCount(1);

        sink.onDispose(() -> runInEventLoop(() -> changeQueueCount(-1)));
        sink.onCancel(() -> runInEventLoop(() -> cancelCommand(commands, observedCommand)));

        processQueue();
    }

    private void cancelCommand(List<PgCommand> commands, PgCommand observedCommand) {
        if (currentCommand == observedCommand && observedCommand.isActive()) {
            cancelRequest();
        } else if (commandQueue.contains(observedCommand)) {
            // not written yet, so the whole group can be dropped
            for (PgCommand command : commands) {
                if (command instanceof Close
                        || command instanceof Parse parse && !UNNAMED.equals(parse.getStatementName())) {
                    // cached statements are shared with later commands
                    continue;
                }
                commandQueue.remove(command);
            }
            updateBacklogLength();
        }
        observedCommand.cancel();
    }

    private void processQueue() {
        if (commandQueue.isEmpty() && PgQueryState.READY.equals(queryState) && properties.autoDisconnect()) {
            commandQueue.add(Terminate.INSTANCE);
        }

        if (PgConnectionStatus.BAD.equals(connectionStatus)) {
            failAllQueuedCommandsWith(new PgConnectionException("Bad connection: " + describeLastError(), lastError));
            PgChannelUtils.closeOnFlush(channel);
            return;
        }

        if (PgConnectionStatus.CLOSED.equals(connectionStatus)) {
            failAllQueuedCommandsWith(new PgConnectionException("Connection closed", lastError));
            return;
        }

        if (commandQueue.isEmpty()) {
            return;
        }

        boolean written = false;

        while (!commandQueue.isEmpty() && PgQueryState.READY.equals(queryState)) {
            PgCommand command = commandQueue.poll();
            if (!command.isActive()) {
                continue;
            }

            log.debug("Sending {}", command);
            channel.write(command.encode(channel.alloc()));
            written = true;

            if (command instanceof Terminate) {
                queryState = PgQueryState.IDLE;
                changePoolClientState(PoolClientState.CLOSING);
                PgChannelUtils.closeOnFlush(channel);
                failAllQueuedCommandsWith(new PgConnectionException("Connection terminated"));
                break;
            }

            if (command.shouldWaitForComplete()) {
                setQueryState(PgQueryState.BUSY);
                queryType = command instanceof Query ? QueryType.SIMPLE : QueryType.EXTENDED;
                currentCommand = command;
                break;
            }
        }

        if (written) {
            channel.flush();
        }
        updateBacklogLength();
    }

    private void completeCurrentCommand() {
        if (currentCommand != null) {
            PgCommand command = currentCommand;
            currentCommand = null;
            command.complete();
        }
    }

    private void failAllQueuedCommandsWith(Throwable throwable) {
        while (!commandQueue.isEmpty()) {
            commandQueue.poll().error(throwable);
        }
        updateBacklogLength();
    }

    private void failAllCommandsWith(Throwable throwable) {
        if (currentCommand != null) {
            PgCommand command = currentCommand;
            currentCommand = null;
            command.error(throwable);
        }
        failAllQueuedCommandsWith(throwable);
    }

    /**
     * Connection can't be used anymore: transport, authentication or protocol failure.
     */
    private void failConnection(Throwable cause) {
        if (PgConnectionStatus.BAD.equals(connectionStatus) || PgConnectionStatus.CLOSED.equals(connectionStatus)) {
            log.debug("Error on already failed connection", cause);
            return;
        }

        log.error("Postgres connection failed", cause);
        lastError = cause;
        setConnectionStatus(PgConnectionStatus.BAD);
        failAllCommandsWith(cause);
        notifyListeners(listener -> listener.error(this, cause));
        PgChannelUtils.closeOnFlush(channel);
    }

    // connect and cancel

    private void doStart() {
        setConnectionStatus(PgConnectionStatus.STARTED);

        connector.connect(
                executor,
                new PgConnectionChannelHandler(this),
                connectedChannel -> runInEventLoop(() -> handleConnected(connectedChannel)),
                cause -> runInEventLoop(() -> handleConnectFailed(cause))
        );
    }

    private void handleConnected(Channel connectedChannel) {
        if (!PgConnectionStatus.STARTED.equals(connectionStatus)) {
            // disconnected or failed while connecting
            connectedChannel.close();
            return;
        }

        channel = connectedChannel;
        messageAssembler = new PgMessageAssembler(connectedChannel.alloc());
        setConnectionStatus(PgConnectionStatus.MADE);

        writeAndFlush(new StartupMessage(createStartupParameters()));
        channel.read();
    }

    private void handleConnectFailed(Throwable cause) {
        PgConnectionException exception = new PgConnectionException(
                "Failed to connect to " + properties.host() + ":" + properties.port(),
                cause
        );
        log.error(exception.getMessage(), cause);

        lastError = exception;
        failAllCommandsWith(exception);
        setConnectionStatus(PgConnectionStatus.BAD);
        notifyListeners(listener -> listener.error(this, exception));
    }

    private void cancelRequest() {
        if (backendKeyData == null) {
            log.debug("Can not cancel command, backend key data not received");
            return;
        }

        CancelRequest cancelRequest = new CancelRequest(backendKeyData.getProcessId(), backendKeyData.getSecretKey());

        connector.connect(
                executor,
                new PgCancelRequestChannelHandler(cancelRequest),
                cancelChannel -> log.debug("Cancel request channel connected"),
                cause -> log.debug("Error connecting for cancellation", cause)
        );
    }

    private Map<String, String> createStartupParameters() {
        Map<String, String> parameters = new LinkedHashMap<>();

        parameters.put(PostgresProtocolGeneralConstants.STARTUP_PARAMETER_USER, properties.user());
        parameters.put(PostgresProtocolGeneralConstants.STARTUP_PARAMETER_DATABASE, properties.database());
        properties.applicationName().ifPresent(
                applicationName -> parameters.put(PostgresProtocolGeneralConstants.STARTUP_PARAMETER_APPLICATION_NAME, applicationName)
        );
        parameters.putAll(properties.startupParameters());

        return parameters;
    }

    // state

    private void setConnectionStatus(PgConnectionStatus status) {
        connectionStatus = status;
        changePoolClientState(PoolClientState.fromConnectionStatus(status));
    }

    private void setQueryState(PgQueryState state) {
        queryState = state;
        changePoolClientState(PoolClientState.fromQueryState(state));
    }

    private void changePoolClientState(PoolClientState state) {
        if (state.equals(poolClientState)) {
            return;
        }
        poolClientState = state;
        notifyListeners(listener -> listener.stateChanged(this, state));
    }

    private void changeQueueCount(int delta) {
        queueCount += delta;
        int count = queueCount;
        updateBacklogLength();
        notifyListeners(listener -> listener.queueCountChanged(this, count));
    }

    private void updateBacklogLength() {
        int count = 0;
        for (PgCommand command : commandQueue) {
            if (command.isObserved()) {
                count++;
            }
        }
        backlogLength = count;
    }

    // helpers

    private void releaseMessageAssembler() {
        if (messageAssembler != null) {
            messageAssembler.release();
            messageAssembler = null;
        }
    }

    private void writeAndFlush(PgCommand command) {
        log.debug("Sending {}", command);
        channel.writeAndFlush(command.encode(channel.alloc()));
    }

    private String requirePassword() {
        return properties.password()
                .filter(StringUtils::isNotEmpty)
                .orElseThrow(() -> new PgAuthenticationException("Server requested password, but no password configured"));
    }

    private ScramSha256Authenticator requireScramAuthenticator() {
        if (scramAuthenticator == null) {
            throw new PgAuthenticationException("SASL exchange was not started");
        }
        return scramAuthenticator;
    }

    private String describeLastError() {
        if (lastError == null) {
            return "unknown error";
        }
        return lastError.getMessage();
    }

    private void notifyListeners(Consumer<PgConnectionEventListener> action) {
        for (PgConnectionEventListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("Connection event listener failed", e);
            }
        }
    }

    private void runInEventLoop(Runnable runnable) {
        if (executor.inEventLoop()) {
            runnable.run();
        } else {
            executor.execute(runnable);
        }
    }

    /**
     * Evicts cached statement which is broken on server, so next call parses it again under new name. Runtime errors,
     * e.g. constraint violations, leave statement cached.
     * <p>
     * Already queued commands may still bind the evicted name. Statement is parsed again under the same name before
     * first of them and closed after the last one.
     */
    private void evictFailedStatement(String sql, String statementName, PgServerErrorException exception) {
        if (statementCache == null
                || UNNAMED.equals(statementName)
                || !isStatementFailure(exception)
                || PgConnectionStatus.BAD.equals(connectionStatus)
                || PgConnectionStatus.CLOSED.equals(connectionStatus)) {
            return;
        }

        if (statementCache.evict(sql, statementName)) {
            log.debug("Prepared statement {} failed with {}, evicting it", statementName, exception.getSqlState());
        }

        List<PgCommand> queued = new ArrayList<>(commandQueue.size() + 3);
        for (PgCommand command : commandQueue) {
            if (command instanceof Close close && statementName.equals(close.getName())) {
                continue;
            }
            queued.add(command);
        }

        int firstBind = -1;
        int lastBind = -1;
        for (int i = 0; i < queued.size(); i++) {
            if (queued.get(i) instanceof Bind bind && statementName.equals(bind.getStatementName())) {
                if (firstBind < 0) {
                    firstBind = i;
                }
                lastBind = i;
            }
        }

        commandQueue.clear();
        commandQueue.add(new Close(PostgresProtocolGeneralConstants.STATEMENT_TARGET, statementName));

        if (firstBind < 0) {
            commandQueue.addAll(queued);
            return;
        }

        int lastSync = lastBind;
        while (lastSync < queued.size() - 1 && !(queued.get(lastSync) instanceof Sync)) {
            lastSync++;
        }

        log.debug("Parsing prepared statement {} again for queued commands", statementName);
        commandQueue.addAll(queued.subList(0, firstBind));
        commandQueue.add(new Parse(statementName, sql));
        commandQueue.addAll(queued.subList(firstBind, lastSync + 1));
        commandQueue.add(new Close(PostgresProtocolGeneralConstants.STATEMENT_TARGET, statementName));
        commandQueue.addAll(queued.subList(lastSync + 1, queued.size()));
    }

    private static boolean isStatementFailure(PgServerErrorException exception) {
        String sqlState = exception.getSqlState();
        return sqlState != null
                && (sqlState.startsWith(PostgresProtocolErrorAndNoticeConstant.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION_CLASS)
                || PostgresProtocolErrorAndNoticeConstant.INVALID_SQL_STATEMENT_NAME_CODE.equals(sqlState));
    }

    private static class FluxSinkCommandObserver implements CommandObserver {
        private final FluxSink<PgRow> sink;

        FluxSinkCommandObserver(FluxSink<PgRow> sink) {
            this.sink = sink;
        }

        @Override
        public void onNext(PgRow row) {
            sink.next(row);
        }

        @Override
        public void onError(Throwable throwable) {
            sink.error(throwable);
        }

        @Override
        public void onComplete() {
            sink.complete();
        }
    }

    private class StatementObserver extends FluxSinkCommandObserver {
        private final String sql;
        private final String statementName;

        StatementObserver(FluxSink<PgRow> sink, String sql, String statementName) {
            super(sink);
            this.sql = sql;
            this.statementName = statementName;
        }

        @Override
        public void onError(Throwable throwable) {
            if (throwable instanceof PgServerErrorException serverError) {
                evictFailedStatement(sql, statementName, serverError);
            }
            super.onError(throwable);
        }
    }
}
