package com.stripedcache.cache;

/**
 * Thrown when a write cannot be admitted because the eviction policy could not free
 * enough room (for example a NoEviction store at capacity).
 *
 * Not fatal: the caller decides whether to retry, remove entries or drop the write.
 */
public class CapacityExceededException extends RuntimeException {
    private final transient Object key;
    private final long capacity;

    public CapacityExceededException(String message, Object key, long capacity) {
        super(message);
        this.key = key;
        this.capacity = capacity;
    }

    /**
     * @return the key whose write was rejected
     */
    public Object getKey() {
        return key;
    }

    /**
     * @return the entry capacity of the store that rejected the write
     */
    public long getCapacity() {
        return capacity;
    }
}
