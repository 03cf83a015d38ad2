package com.github.dimitryivaniuta.metergateway.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.dimitryivaniuta.metergateway.gateway.cache.CacheStats;

public record CacheStatsResponse(
        @JsonProperty("hits_tier1") long hitsTier1,
        @JsonProperty("hits_tier2") long hitsTier2,
        long misses,
        long promotions,
        long evictions,
        long sets,
        @JsonProperty("degraded_operations") long degradedOperations,
        @JsonProperty("total_requests") long totalRequests,
        @JsonProperty("hit_rate_percent") double hitRatePercent,
        @JsonProperty("fast_tier_size") long fastTierSize,
        @JsonProperty("persistent_tier_size") long persistentTierSize
) {

    public static CacheStatsResponse from(CacheStats s) {
        return new CacheStatsResponse(
                s.hitsTier1(), s.hitsTier2(), s.misses(), s.promotions(), s.evictions(), s.sets(),
                s.degradedOperations(), s.totalRequests(), s.hitRatePercent(),
                s.fastTierSize(), s.persistentTierSize()
        );
    }
}
