package com.github.dimitryivaniuta.metergateway.gateway.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * Persistent-tier record. {@code payload} is the JSON form of the cached value.
 * {@code writeSeq} orders writes of the same key: a store keeps the entry with the highest sequence.
 */
public record StoredEntry(String key, String payload, Instant createdAt, Instant expiresAt, long writeSeq) {

    public StoredEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    /** An entry is live strictly before {@code expiresAt}. */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /** True when this entry may replace {@code current} for the same key. */
    public boolean supersedes(StoredEntry current) {
        return current == null || writeSeq > current.writeSeq;
    }
}
