package com.lantromipis.pgasync.connection.statement;

import org.apache.commons.collections4.map.AbstractLinkedMap;
import org.apache.commons.collections4.map.LRUMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Per connection LRU cache of named prepared statements, keyed by SQL. Names of evicted statements are collected so
 * connection can close them on server.
 */
public class PreparedStatementCache {

    private static final String STATEMENT_NAME_PREFIX = "pgasync_";

    private final StatementsMap statements;
    private final List<String> evictedStatementNames = new ArrayList<>();
    private long nextStatementId = 1;

    public PreparedStatementCache(int maxSize) {
        this.statements = new StatementsMap(maxSize);
    }

    /**
     * @return name of already parsed statement or null
     */
    public String get(String sql) {
        return statements.get(sql);
    }

    /**
     * Registers new statement for SQL.
     *
     * @return name for the new statement
     */
    public String register(String sql) {
        String name = STATEMENT_NAME_PREFIX + nextStatementId++;
        statements.put(sql, name);
        return name;
    }

    /**
     * Removes statement if it is still registered under given name.
     *
     * @return true if removed
     */
    public boolean evict(String sql, String name) {
        if (name.equals(statements.get(sql, false))) {
            statements.remove(sql);
            return true;
        }
        return false;
    }

    /**
     * @return names of statements evicted since last call
     */
    public List<String> drainEvictedStatementNames() {
        List<String> ret = new ArrayList<>(evictedStatementNames);
        evictedStatementNames.clear();
        return ret;
    }

    public int size() {
        return statements.size();
    }

    private class StatementsMap extends LRUMap<String, String> {

        StatementsMap(int maxSize) {
            super(maxSize);
        }

        @Override
        protected boolean removeLRU(AbstractLinkedMap.LinkEntry<String, String> entry) {
            evictedStatementNames.add(entry.getValue());
            return true;
        }
    }
}
