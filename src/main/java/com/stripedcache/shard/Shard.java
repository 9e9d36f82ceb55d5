package com.stripedcache.shard;

import com.stripedcache.cache.CacheStore;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * One independently locked partition of a {@link ShardedCache}: a store plus the lock
 * guarding it. The store's policy and stats counter are private to the shard.
 */
final class Shard<K, V> {
    private final int index;
    private final CacheStore<K, V> store;
    private final ReentrantLock lock;

    Shard(int index, CacheStore<K, V> store) {
        this.index = index;
        this.store = Objects.requireNonNull(store, "store");
        this.lock = new ReentrantLock();
    }

    /**
     * Run {@code action} against the store while holding this shard's lock. The lock is
     * released when the action returns or throws.
     */
    <R> R withLock(Function<CacheStore<K, V>, R> action) {
        lock.lock();
        try {
            return action.apply(store);
        } finally {
            lock.unlock();
        }
    }

    int getIndex() {
        return index;
    }
}
