package com.lantromipis.pgasync.connectionpool;

import com.lantromipis.pgasync.configuration.properties.PgConnectionPoolProperties;
import com.lantromipis.pgasync.configuration.properties.PgConnectionProperties;
import com.lantromipis.pgasync.connection.PgConnection;
import com.lantromipis.pgasync.connection.api.PgConnectionEventListener;
import com.lantromipis.pgasync.connection.model.PoolClientState;
import com.lantromipis.pgasync.connection.transport.NettyPgChannelConnector;
import com.lantromipis.pgasync.connection.transport.PgChannelConnector;
import com.lantromipis.pgasync.connectionpool.model.stats.PgConnectionPoolStats;
import com.lantromipis.pgasync.postgresprotocol.exception.PgConnectionException;
import com.lantromipis.pgasync.postgresprotocol.model.PgRow;
import io.netty.channel.EventLoopGroup;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes queries to the least busy of lazily created connections. Pool never waits for a free connection: when limit
 * is reached, query is queued on connection with the smallest backlog.
 */
@Slf4j
public class PgConnectionPool implements AutoCloseable {

    private final PgConnectionProperties connectionProperties;
    private final PgConnectionPoolProperties poolProperties;
    private final PgChannelConnector connector;
    private final EventLoopGroup ownedWorkerGroup;

    private final List<PgConnection> connections = new CopyOnWriteArrayList<>();
    private final AtomicBoolean poolActive = new AtomicBoolean(true);

    /**
     * Creates pool with own event loop group, which is shut down on {@link #close()}.
     */
    public PgConnectionPool(final PgConnectionProperties connectionProperties, final PgConnectionPoolProperties poolProperties) {
        this.connectionProperties = connectionProperties;
        this.poolProperties = poolProperties;
        this.ownedWorkerGroup = NettyPgChannelConnector.createEventLoopGroup(poolProperties.eventLoopThreads());
        this.connector = new NettyPgChannelConnector(ownedWorkerGroup, connectionProperties);
    }

    public PgConnectionPool(final PgConnectionProperties connectionProperties,
                            final PgConnectionPoolProperties poolProperties,
                            final PgChannelConnector connector) {
        this.connectionProperties = connectionProperties;
        this.poolProperties = poolProperties;
        this.ownedWorkerGroup = null;
        this.connector = connector;
    }

    public Flux<PgRow> query(String sql) {
        return Flux.defer(() -> getLeastBusyConnection().query(sql));
    }

    public Flux<PgRow> executeStatement(String sql, List<?> parameters) {
        return Flux.defer(() -> getLeastBusyConnection().executeStatement(sql, parameters));
    }

    public Mono<List<PgRow>> executeStatementForList(String sql, List<?> parameters) {
        return executeStatement(sql, parameters).collectList();
    }

    /**
     * @return pooled connection which is ready and has nothing queued, new pooled connection if limit is not reached,
     * otherwise null
     */
    public synchronized PgConnection getIdleConnection() {
        checkPoolActive();

        PgConnection idle = findIdleConnection();
        if (idle != null) {
            return idle;
        }

        if (connections.size() < poolProperties.maxConnections()) {
            return createConnection(true);
        }

        return null;
    }

    /**
     * @return new connection which is not tracked by pool, caller must disconnect it
     */
    public PgConnection getDedicatedConnection() {
        checkPoolActive();
        return createConnection(false);
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public PgConnectionPoolStats getStats() {
        return PgConnectionPoolStats
                .builder()
                .connectionsLimit(poolProperties.maxConnections())
                .allConnectionsCount(connections.size())
                .idleConnectionsCount(CollectionUtils.countMatches(connections, this::isIdle))
                .busyConnectionsCount(CollectionUtils.countMatches(connections, c -> PoolClientState.BUSY.equals(c.getPoolClientState())))
                .backlogLength(connections.stream().mapToInt(PgConnection::getBacklogLength).sum())
                .build();
    }

    @Override
    public void close() {
        if (!poolActive.compareAndSet(true, false)) {
            return;
        }

        log.debug("Closing connection pool with {} connections", connections.size());
        connections.forEach(PgConnection::disconnect);
        connections.clear();

        if (ownedWorkerGroup != null) {
            ownedWorkerGroup.shutdownGracefully();
        }
    }

    synchronized PgConnection getLeastBusyConnection() {
        checkPoolActive();

        if (connectionProperties.autoDisconnect()) {
            // connection terminates itself after queue is drained, so it can't be shared
            return createConnection(false);
        }

        PgConnection idle = findIdleConnection();
        if (idle != null) {
            return idle;
        }

        if (connections.size() < poolProperties.maxConnections()) {
            return createConnection(true);
        }

        return connections
                .stream()
                .min(Comparator.comparingInt(PgConnection::getBacklogLength))
                .orElseGet(() -> createConnection(true));
    }

    private PgConnection findIdleConnection() {
        for (PgConnection connection : connections) {
            if (isIdle(connection)) {
                return connection;
            }
        }
        return null;
    }

    private boolean isIdle(PgConnection connection) {
        return connection.getBacklogLength() == 0 && PoolClientState.READY.equals(connection.getPoolClientState());
    }

    private PgConnection createConnection(boolean pooled) {
        PgConnection connection = new PgConnection(connectionProperties, connector);

        if (pooled) {
            connection.addListener(new PgConnectionEventListener() {
                @Override
                public void error(PgConnection failed, Throwable cause) {
                    removeConnection(failed);
                }

                @Override
                public void closed(PgConnection closed) {
                    removeConnection(closed);
                }
            });
            connections.add(connection);
            log.debug("Created pooled connection, pool size {}", connections.size());
        }

        return connection;
    }

    private void removeConnection(PgConnection connection) {
        if (connections.remove(connection)) {
            log.debug("Removed connection from pool, pool size {}", connections.size());
        }
    }

    private void checkPoolActive() {
        if (!poolActive.get()) {
            throw new PgConnectionException("Connection pool is closed");
        }
    }
}
