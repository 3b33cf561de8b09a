package com.lantromipis.pgasync.connectionpool.model.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PgConnectionPoolStats {
    private int connectionsLimit;
    private int allConnectionsCount;
    private int idleConnectionsCount;
    private int busyConnectionsCount;
    /**
     * Sum of backlogs of all pooled connections.
     */
    private int backlogLength;
}
