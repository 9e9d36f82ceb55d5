package com.stripedcache.eviction;

import com.stripedcache.cache.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Adaptive policy that switches between LRU and LFU victim selection.
 *
 * Every eviction where the two strategies disagree leaves two marks: the key actually
 * evicted (remembered under the active mode) and the key the other mode would have
 * evicted instead (remembered under the other mode). A later miss on an evicted key is a
 * miss the active mode caused; a later hit on a spared key is a miss the other mode would
 * have caused. After every {@code window} observed hits and misses, the mode charged with
 * fewer misses becomes active. Ties keep the current mode.
 *
 * Both marks are bounded to the window size, so bookkeeping stays proportional to it.
 */
public class AdaptiveEvictionPolicy<K, V> implements EvictionPolicy<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(AdaptiveEvictionPolicy.class);

    public enum Mode {
        LRU,
        LFU;

        Mode other() {
            return this == LRU ? LFU : LRU;
        }
    }

    private final int window;
    private final Map<K, Mode> evicted;
    private final Map<K, Mode> spared;
    private Mode mode;
    private long lruMisses;
    private long lfuMisses;
    private int observed;

    public AdaptiveEvictionPolicy(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Adaptive window must be positive, got: " + window);
        }
        this.window = window;
        this.evicted = boundedMap(window);
        this.spared = boundedMap(window);
        this.mode = Mode.LRU;
    }

    private static <K> Map<K, Mode> boundedMap(int maxEntries) {
        return new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, Mode> eldest) {
                return size() > maxEntries;
            }
        };
    }

    @Override
    public void onInsert(CacheEntry<K, V> entry) {
        evicted.remove(entry.getKey());
    }

    @Override
    public void onAccess(CacheEntry<K, V> entry, long tick) {
        entry.recordAccess(tick);
        Mode wouldHaveMissed = spared.remove(entry.getKey());
        if (wouldHaveMissed != null) {
            charge(wouldHaveMissed);
        }
        observe();
    }

    @Override
    public void onMiss(K key) {
        Mode causedMiss = evicted.remove(key);
        if (causedMiss != null) {
            charge(causedMiss);
        }
        observe();
    }

    @Override
    public void onRemove(CacheEntry<K, V> entry) {
        spared.remove(entry.getKey());
    }

    @Override
    public Optional<K> selectVictim(Collection<CacheEntry<K, V>> entries, long now) {
        Optional<CacheEntry<K, V>> lruVictim = entries.stream().min(LRUEvictionPolicy.recencyOrder());
        if (lruVictim.isEmpty()) {
            return Optional.empty();
        }
        CacheEntry<K, V> lfuVictim = entries.stream().min(LFUEvictionPolicy.frequencyOrder()).get();

        CacheEntry<K, V> victim = mode == Mode.LRU ? lruVictim.get() : lfuVictim;
        CacheEntry<K, V> alternative = mode == Mode.LRU ? lfuVictim : lruVictim.get();
        if (victim != alternative) {
            evicted.put(victim.getKey(), mode);
            spared.put(alternative.getKey(), mode.other());
        }
        return Optional.of(victim.getKey());
    }

    @Override
    public void clear() {
        evicted.clear();
        spared.clear();
        lruMisses = 0;
        lfuMisses = 0;
        observed = 0;
    }

    @Override
    public String getPolicyName() {
        return "ADAPTIVE(" + mode + ")";
    }

    public Mode getMode() {
        return mode;
    }

    private void charge(Mode culprit) {
        if (culprit == Mode.LRU) {
            lruMisses++;
        } else {
            lfuMisses++;
        }
    }

    private void observe() {
        observed++;
        if (observed < window) {
            return;
        }

        long activeMisses = mode == Mode.LRU ? lruMisses : lfuMisses;
        long otherMisses = mode == Mode.LRU ? lfuMisses : lruMisses;
        if (otherMisses < activeMisses) {
            logger.debug("Adaptive policy switching from {} to {} (misses {} vs {})",
                    mode, mode.other(), activeMisses, otherMisses);
            mode = mode.other();
        }
        lruMisses = 0;
        lfuMisses = 0;
        observed = 0;
    }
}
