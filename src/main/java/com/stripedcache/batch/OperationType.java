package com.stripedcache.batch;

/**
 * Type of batch operation
 */
public enum OperationType {
    /**
     * Insert or replace a key-value pair
     */
    INSERT,

    /**
     * Remove a key
     */
    REMOVE,

    /**
     * Look up a key
     */
    GET
}
