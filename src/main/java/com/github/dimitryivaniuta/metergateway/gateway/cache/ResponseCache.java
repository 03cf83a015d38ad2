package com.github.dimitryivaniuta.metergateway.gateway.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value operations request handlers need. Implemented by {@link TierCache}.
 */
public interface ResponseCache {

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value, Duration fastTierTtl, Duration persistentTierTtl);

    /** Uses the configured default TTLs of both tiers. */
    void set(String key, Object value);

    /**
     * @param keyOrPattern exact key, or a prefix pattern such as {@code meter:42:*}
     * @return entries removed across both tiers
     */
    int invalidate(String keyOrPattern);

    CacheStats stats();
}
