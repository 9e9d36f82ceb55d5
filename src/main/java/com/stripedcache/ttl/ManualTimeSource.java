package com.stripedcache.ttl;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logical clock that only moves when told to. Lets hosts and tests drive expiry deterministically.
 */
public class ManualTimeSource implements TimeSource {
    private final AtomicLong nanos;

    public ManualTimeSource() {
        this(0L);
    }

    public ManualTimeSource(long startNanos) {
        this.nanos = new AtomicLong(startNanos);
    }

    @Override
    public long read() {
        return nanos.get();
    }

    /**
     * Advance by a number of logical ticks (one tick is one nanosecond).
     */
    public void advance(long ticks) {
        if (ticks < 0) {
            throw new IllegalArgumentException("Cannot move time backwards, got: " + ticks);
        }
        nanos.addAndGet(ticks);
    }

    public void advance(Duration duration) {
        advance(duration.toNanos());
    }

    /**
     * Advance by one logical tick.
     */
    public void tick() {
        advance(1L);
    }
}
