package com.github.dimitryivaniuta.metergateway.gateway.cache;

import lombok.Builder;

import java.time.Duration;

/**
 * @param fastTierCapacity     max entries in the fast tier
 * @param fastTierTtl          default fast-tier TTL, also used for every promotion
 * @param persistentTierTtl    default persistent-tier TTL
 * @param persistentMaxEntries cull target for the persistent tier
 * @param persistentTimeout    max wait for a request-path persistent-tier call
 * @param maintenanceTimeout   max wait for one sweep batch
 * @param batchSize            rows per sweep batch
 * @param lockStripes          number of per-key lock stripes
 */
@Builder
public record TierCacheSettings(
        int fastTierCapacity,
        Duration fastTierTtl,
        Duration persistentTierTtl,
        long persistentMaxEntries,
        Duration persistentTimeout,
        Duration maintenanceTimeout,
        int batchSize,
        int lockStripes
) {

    public TierCacheSettings {
        if (fastTierCapacity <= 0) throw new IllegalArgumentException("fastTierCapacity must be >= 1");
        requirePositive(fastTierTtl, "fastTierTtl");
        requirePositive(persistentTierTtl, "persistentTierTtl");
        requirePositive(persistentTimeout, "persistentTimeout");
        requirePositive(maintenanceTimeout, "maintenanceTimeout");
        if (persistentMaxEntries <= 0) throw new IllegalArgumentException("persistentMaxEntries must be >= 1");
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be >= 1");
        if (lockStripes <= 0) lockStripes = 256;
    }

    static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
