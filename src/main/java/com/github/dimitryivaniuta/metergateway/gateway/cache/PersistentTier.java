package com.github.dimitryivaniuta.metergateway.gateway.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage engine behind the persistent cache tier. Implementations perform blocking I/O and may
 * throw any runtime exception on failure; {@link TierCache} only calls them from its I/O executor.
 */
public interface PersistentTier {

    /** Live entry for {@code key}; expired entries are reported as absent. */
    Optional<StoredEntry> find(String key, Instant now);

    /**
     * Inserts the entry for {@code entry.key()}, or replaces the stored one when
     * {@code entry.writeSeq()} is higher. A write with a lower or equal sequence is dropped.
     */
    void put(StoredEntry entry);

    boolean delete(String key);

    /** Deletes every key starting with {@code prefix} (a literal string, not a pattern). */
    int deleteByPrefix(String prefix);

    /** Deletes at most {@code limit} entries with {@code expiresAt <= now}. */
    int deleteExpired(Instant now, int limit);

    /**
     * Deletes at most {@code limit} of the oldest-inserted entries while more than {@code maxEntries} remain.
     *
     * @return number deleted in this call
     */
    int cullOldest(long maxEntries, int limit);

    long count();

    void clear();
}
