package com.github.dimitryivaniuta.metergateway.support;

import com.github.dimitryivaniuta.metergateway.gateway.cache.PersistentTier;
import com.github.dimitryivaniuta.metergateway.gateway.cache.StoredEntry;

import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Map-backed persistent tier. {@link #failing(boolean)} makes every call throw, like an unreachable database.
 * Subclasses override single operations to make them slow or gated.
 */
public class InMemoryPersistentTier implements PersistentTier {

    private final ConcurrentSkipListMap<String, StoredEntry> entries = new ConcurrentSkipListMap<>();
    private final AtomicBoolean failing = new AtomicBoolean(false);
    private final AtomicInteger calls = new AtomicInteger();

    public void failing(boolean value) {
        failing.set(value);
    }

    public int calls() {
        return calls.get();
    }

    /** Raw view, including expired entries. */
    public Optional<StoredEntry> raw(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public Optional<StoredEntry> find(String key, Instant now) {
        check();
        StoredEntry e = entries.get(key);
        return e == null || e.isExpired(now) ? Optional.empty() : Optional.of(e);
    }

    @Override
    public void put(StoredEntry entry) {
        check();
        // same rule as the database upsert: a lower or equal sequence never replaces the stored row
        entries.compute(entry.key(), (key, current) -> entry.supersedes(current) ? entry : current);
    }

    @Override
    public boolean delete(String key) {
        check();
        return entries.remove(key) != null;
    }

    @Override
    public int deleteByPrefix(String prefix) {
        check();
        int removed = 0;
        Iterator<String> it = entries.tailMap(prefix, false).keySet().iterator();
        while (it.hasNext()) {
            String key = it.next();
            if (!key.startsWith(prefix)) break;
            it.remove();
            removed++;
        }
        return removed;
    }

    @Override
    public int deleteExpired(Instant now, int limit) {
        check();
        List<String> expired = entries.values().stream()
                .filter(e -> e.isExpired(now))
                .sorted(Comparator.comparing(StoredEntry::expiresAt))
                .limit(limit)
                .map(StoredEntry::key)
                .collect(Collectors.toList());
        expired.forEach(entries::remove);
        return expired.size();
    }

    @Override
    public int cullOldest(long maxEntries, int limit) {
        check();
        long excess = entries.size() - maxEntries;
        if (excess <= 0) return 0;
        List<String> oldest = entries.values().stream()
                .sorted(Comparator.comparing(StoredEntry::createdAt))
                .limit(Math.min(excess, limit))
                .map(StoredEntry::key)
                .collect(Collectors.toList());
        oldest.forEach(entries::remove);
        return oldest.size();
    }

    @Override
    public long count() {
        check();
        return entries.size();
    }

    @Override
    public void clear() {
        check();
        entries.clear();
    }

    public Map<String, StoredEntry> snapshot() {
        return Map.copyOf(entries);
    }

    private void check() {
        calls.incrementAndGet();
        if (failing.get()) {
            throw new IllegalStateException("persistent tier is down");
        }
    }
}
