package com.github.dimitryivaniuta.metergateway.gateway.cache;

/**
 * Point-in-time snapshot. Counters are monotonic since the cache started;
 * {@code persistentTierSize} is -1 when the persistent tier could not be counted.
 */
public record CacheStats(
        long hitsTier1,
        long hitsTier2,
        long misses,
        long promotions,
        long evictions,
        long sets,
        long degradedOperations,
        long fastTierSize,
        long persistentTierSize
) {

    public long totalRequests() {
        return hitsTier1 + hitsTier2 + misses;
    }

    public double hitRatePercent() {
        long total = totalRequests();
        if (total == 0) return 0.0;
        return Math.round((hitsTier1 + hitsTier2) * 10_000.0 / total) / 100.0;
    }
}
