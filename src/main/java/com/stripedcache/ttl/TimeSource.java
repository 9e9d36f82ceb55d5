package com.stripedcache.ttl;

/**
 * Source of the current time used for TTL decisions.
 *
 * Values are nanoseconds on an arbitrary origin and only meaningful relative to each other.
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * @return current time in nanoseconds
     */
    long read();

    /**
     * @return the wall clock backed source used in production
     */
    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }
}
