package com.github.dimitryivaniuta.metergateway.gateway.cache.jpa;

import com.github.dimitryivaniuta.metergateway.gateway.cache.PersistentTier;
import com.github.dimitryivaniuta.metergateway.gateway.cache.StoredEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * PostgreSQL-backed persistent tier ({@code tier_cache_entry}).
 */
@Slf4j
@RequiredArgsConstructor
public class JpaPersistentTier implements PersistentTier {

    private final CacheEntryRecordRepository repo;

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredEntry> find(String key, Instant now) {
        return repo.findByCacheKeyAndExpiresAtAfter(key, now).map(CacheEntryRecord::toStoredEntry);
    }

    @Override
    @Transactional
    public void put(StoredEntry entry) {
        if (repo.upsert(entry.key(), entry.payload(), entry.createdAt(), entry.expiresAt(), entry.writeSeq()) == 0) {
            log.debug("Dropped stale write for key={} writeSeq={}", entry.key(), entry.writeSeq());
        }
    }

    @Override
    @Transactional
    public boolean delete(String key) {
        return repo.deleteByKey(key) > 0;
    }

    @Override
    @Transactional
    public int deleteByPrefix(String prefix) {
        // '_%' requires at least one character after the prefix
        return repo.deleteByKeyLike(escapeLike(prefix) + "_%");
    }

    @Override
    @Transactional
    public int deleteExpired(Instant now, int limit) {
        return repo.deleteExpiredBatch(now, limit);
    }

    @Override
    @Transactional
    public int cullOldest(long maxEntries, int limit) {
        long excess = repo.count() - maxEntries;
        if (excess <= 0) return 0;
        int deleted = repo.deleteOldest((int) Math.min(excess, limit));
        log.debug("Culled {} persistent cache entries (excess was {})", deleted, excess);
        return deleted;
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return repo.count();
    }

    @Override
    @Transactional
    public void clear() {
        repo.deleteAllInBatch();
    }

    static String escapeLike(String literal) {
        StringBuilder sb = new StringBuilder(literal.length() + 8);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '\\' || c == '%' || c == '_') sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }
}
