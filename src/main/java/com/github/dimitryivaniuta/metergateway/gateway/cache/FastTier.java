package com.github.dimitryivaniuta.metergateway.gateway.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bounded in-process tier on top of Caffeine.
 *
 * <ul>
 *   <li>Per-entry TTL through Caffeine variable expiry; the ticker is driven by the injected clock.</li>
 *   <li>Capacity is enforced here, oldest insertion first, instead of Caffeine's size policy
 *       (which would pick by frequency).</li>
 * </ul>
 * Caffeine maintenance runs on the calling thread so eviction counters are exact.
 */
final class FastTier {

    static final class Entry {
        final String key;
        final Object value;
        final Instant createdAt;
        final Instant expiresAt;

        Entry(String key, Object value, Instant createdAt, Instant expiresAt) {
            this.key = key;
            this.value = value;
            this.createdAt = createdAt;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    private final int capacity;
    private final Clock clock;
    private final Cache<String, Entry> cache;

    // insertion order; may hold stale entries (overwritten/removed), skipped on eviction and pruned on sweep
    private final ConcurrentLinkedQueue<Entry> insertionOrder = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queued = new AtomicInteger();

    private final LongAdder expired = new LongAdder();
    private final LongAdder capacityEvictions = new LongAdder();

    FastTier(int capacity, Clock clock) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.cache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .expireAfter(new EntryExpiry())
                .removalListener((String key, Entry entry, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) expired.increment();
                })
                .build();
    }

    Optional<Entry> get(String key) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    Entry put(String key, Object value, Duration ttl) {
        Instant now = clock.instant();
        Entry entry = new Entry(key, value, now, now.plus(ttl));
        cache.put(key, entry);
        insertionOrder.add(entry);
        if (queued.incrementAndGet() > 2 * capacity + 64) {
            pruneInsertionOrder();
        }
        enforceCapacity();
        return entry;
    }

    boolean remove(String key) {
        return cache.asMap().remove(key) != null;
    }

    /** Removes {@code key} only while it still maps to {@code entry}. */
    boolean remove(String key, Entry entry) {
        return cache.asMap().remove(key, entry);
    }

    int removeByPrefix(String prefix) {
        int removed = 0;
        for (String key : cache.asMap().keySet()) {
            if (CacheKeys.matchesPrefix(key, prefix) && cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Eagerly removes expired entries.
     *
     * @return entries expired by this call
     */
    long sweepExpired() {
        long before = expired.sum();
        cache.cleanUp();
        pruneInsertionOrder();
        return expired.sum() - before;
    }

    void clear() {
        cache.invalidateAll();
        insertionOrder.clear();
        queued.set(0);
    }

    long size() {
        return cache.estimatedSize();
    }

    /** TTL expirations plus capacity evictions since construction. */
    long evictions() {
        return expired.sum() + capacityEvictions.sum();
    }

    private void enforceCapacity() {
        while (cache.estimatedSize() > capacity) {
            Entry oldest = insertionOrder.poll();
            if (oldest == null) return;
            queued.decrementAndGet();
            if (cache.asMap().remove(oldest.key, oldest)) {
                capacityEvictions.increment();
            }
        }
    }

    private void pruneInsertionOrder() {
        Iterator<Entry> it = insertionOrder.iterator();
        while (it.hasNext()) {
            Entry e = it.next();
            if (cache.asMap().get(e.key) != e) {
                it.remove();
                queued.decrementAndGet();
            }
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return remaining(entry, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return remaining(entry, currentTime);
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long remaining(Entry entry, long currentTime) {
            long expiresAtNanos = TimeUnit.MILLISECONDS.toNanos(entry.expiresAt.toEpochMilli());
            return Math.max(0L, expiresAtNanos - currentTime);
        }
    }
}
