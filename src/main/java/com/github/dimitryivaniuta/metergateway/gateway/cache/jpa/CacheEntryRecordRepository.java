package com.github.dimitryivaniuta.metergateway.gateway.cache.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface CacheEntryRecordRepository extends JpaRepository<CacheEntryRecord, Long> {

    Optional<CacheEntryRecord> findByCacheKeyAndExpiresAtAfter(String cacheKey, Instant now);

    /**
     * Insert, or replace by key when {@code writeSeq} is higher than the stored one.
     * {@code created_at} is reset on replace so culling stays oldest-insertion-first.
     *
     * @return 0 when an existing row with an equal or higher sequence was kept
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
            insert into tier_cache_entry (cache_key, payload, created_at, expires_at, write_seq)
            values (:key, cast(:payload as jsonb), :createdAt, :expiresAt, :writeSeq)
            on conflict (cache_key) do update
               set payload = excluded.payload,
                   created_at = excluded.created_at,
                   expires_at = excluded.expires_at,
                   write_seq = excluded.write_seq
             where tier_cache_entry.write_seq < excluded.write_seq
            """, nativeQuery = true)
    int upsert(@Param("key") String key,
               @Param("payload") String payload,
               @Param("createdAt") Instant createdAt,
               @Param("expiresAt") Instant expiresAt,
               @Param("writeSeq") long writeSeq);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from CacheEntryRecord e where e.cacheKey = :key")
    int deleteByKey(@Param("key") String key);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from CacheEntryRecord e
            where e.cacheKey like :likePrefix escape '\\'
            """)
    int deleteByKeyLike(@Param("likePrefix") String likePrefix);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
            delete from tier_cache_entry
            where id in (
                select id from tier_cache_entry
                where expires_at <= :now
                order by expires_at
                limit :limit)
            """, nativeQuery = true)
    int deleteExpiredBatch(@Param("now") Instant now, @Param("limit") int limit);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
            delete from tier_cache_entry
            where id in (
                select id from tier_cache_entry
                order by created_at, id
                limit :limit)
            """, nativeQuery = true)
    int deleteOldest(@Param("limit") int limit);
}
