package com.lantromipis.pgasync.postgresprotocol.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single materialized result row. Values are {@link String} in Postgres text format, {@link Boolean} for bool columns
 * or null for SQL NULL.
 * <p>
 * If query returns several columns with same name, lookup by name returns the last one. Use index based access for such rows.
 */
@ToString
@EqualsAndHashCode
public class PgRow {
    private final List<String> columnNames;
    private final List<Object> values;
    private final LinkedHashMap<String, Object> columns;

    public PgRow(List<String> columnNames, List<Object> values) {
        this.columnNames = Collections.unmodifiableList(columnNames);
        this.values = Collections.unmodifiableList(values);
        this.columns = new LinkedHashMap<>();

        for (int i = 0; i < columnNames.size(); i++) {
            columns.put(columnNames.get(i), values.get(i));
        }
    }

    public int size() {
        return values.size();
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public boolean containsColumn(String name) {
        return columns.containsKey(name);
    }

    public Object getCellValueByName(String name) {
        return columns.get(name);
    }

    public String getCellValueByNameAsString(String name) {
        Object value = columns.get(name);

        if (value == null) {
            return null;
        }

        return value.toString();
    }

    public Boolean getCellValueByNameAsBoolean(String name) {
        Object value = columns.get(name);

        if (value == null) {
            return null;
        }

        if (value instanceof Boolean) {
            return (Boolean) value;
        }

        throw new ClassCastException("Column '" + name + "' is not a bool column");
    }

    public Object getCellValueByIdx(int idx) {
        return values.get(idx);
    }

    public String getCellValueByIdxAsString(int idx) {
        Object value = values.get(idx);

        if (value == null) {
            return null;
        }

        return value.toString();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(columns);
    }
}
