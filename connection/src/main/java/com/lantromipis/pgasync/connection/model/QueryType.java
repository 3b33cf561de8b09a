package com.lantromipis.pgasync.connection.model;

/**
 * Protocol used by current command.
 */
public enum QueryType {
    NONE,
    SIMPLE,
    EXTENDED
}
