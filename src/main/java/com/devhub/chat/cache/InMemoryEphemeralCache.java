package com.devhub.chat.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Single-node cache on Caffeine. Every entry carries its own time to live;
 * expired entries are evicted by Caffeine's maintenance whether or not they
 * are read again.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "chat.cache.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryEphemeralCache implements EphemeralCache {

    private final Cache<String, Entry> entries;

    public InMemoryEphemeralCache() {
        this(Ticker.systemTicker(), ForkJoinPool.commonPool(), Scheduler.systemScheduler());
    }

    InMemoryEphemeralCache(Ticker ticker, Executor executor, Scheduler scheduler) {
        this.entries = Caffeine.newBuilder()
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .executor(executor)
                .scheduler(scheduler)
                .build();
        log.info("Using in-memory ephemeral cache");
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, Entry.value(value, ttl));
    }

    @Override
    public void delete(String key) {
        entries.invalidate(key);
    }

    @Override
    public long incrementWithExpiry(String key, Duration ttl) {
        Entry updated = entries.asMap().compute(key, (k, existing) -> {
            if (existing == null || existing.value == null) {
                return Entry.value("1", ttl);
            }
            return existing.incremented();
        });
        return Long.parseLong(updated.value);
    }

    @Override
    public void appendToList(String key, String value, int maxLength, Duration ttl) {
        entries.asMap().compute(key, (k, existing) -> {
            List<String> list = existing == null || existing.list == null
                    ? new ArrayList<>()
                    : new ArrayList<>(existing.list);
            list.add(value);
            if (list.size() > maxLength) {
                list = new ArrayList<>(list.subList(list.size() - maxLength, list.size()));
            }
            return Entry.list(list, ttl);
        });
    }

    @Override
    public List<String> listRange(String key) {
        Entry entry = entries.getIfPresent(key);
        return entry == null || entry.list == null ? List.of() : new ArrayList<>(entry.list);
    }

    @Override
    public void replaceList(String key, List<String> values, Duration ttl) {
        entries.put(key, Entry.list(new ArrayList<>(values), ttl));
    }

    /** Live entries after pending evictions have run. */
    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    // Entries are immutable; every write swaps in a new one
    private static final class Entry {
        private final String value;
        private final List<String> list;
        private final long ttlNanos;
        // an increment keeps the window opened by the first hit
        private final boolean keepsExpiry;

        private Entry(String value, List<String> list, long ttlNanos, boolean keepsExpiry) {
            this.value = value;
            this.list = list;
            this.ttlNanos = ttlNanos;
            this.keepsExpiry = keepsExpiry;
        }

        static Entry value(String value, Duration ttl) {
            return new Entry(value, null, nanos(ttl), false);
        }

        static Entry list(List<String> list, Duration ttl) {
            return new Entry(null, list, nanos(ttl), false);
        }

        Entry incremented() {
            return new Entry(String.valueOf(Long.parseLong(value) + 1), null, ttlNanos, true);
        }

        private static long nanos(Duration ttl) {
            return ttl == null ? Long.MAX_VALUE : ttl.toNanos();
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.keepsExpiry ? currentDuration : entry.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
