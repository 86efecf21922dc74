package com.devhub.chat.support;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion scoped to a key (a room id, a buffer key, ...).
 * Locks are created on demand and dropped once no thread holds or waits for them,
 * so the map only ever contains keys that are currently contended.
 */
public class KeyedLocks<K> {

    private final Map<K, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        Entry entry = acquire(key);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(key);
        }
    }

    public void withLock(K key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /** Number of keys currently locked or waited on. */
    public int size() {
        return locks.size();
    }

    private Entry acquire(K key) {
        return locks.compute(key, (k, existing) -> {
            Entry entry = existing != null ? existing : new Entry();
            entry.holders++;
            return entry;
        });
    }

    private void release(K key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.holders == 0 ? null : entry);
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int holders;
    }
}
