package com.github.dimitryivaniuta.metergateway.gateway.cache.jpa;

import com.github.dimitryivaniuta.metergateway.gateway.cache.StoredEntry;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "tier_cache_entry")
public class CacheEntryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cache_key", nullable = false, unique = true, length = 512)
    private String cacheKey;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private String payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "write_seq", nullable = false)
    private long writeSeq;

    public StoredEntry toStoredEntry() {
        return new StoredEntry(cacheKey, payload, createdAt, expiresAt, writeSeq);
    }
}
