package com.stripedcache.ttl;

/**
 * Monotonic time source backed by {@link System#nanoTime()}.
 */
public enum SystemTimeSource implements TimeSource {
    INSTANCE;

    @Override
    public long read() {
        return System.nanoTime();
    }
}
