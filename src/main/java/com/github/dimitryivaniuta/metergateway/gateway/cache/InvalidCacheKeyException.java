package com.github.dimitryivaniuta.metergateway.gateway.cache;

/**
 * A cache key or invalidation pattern that does not follow the key grammar.
 */
public class InvalidCacheKeyException extends IllegalArgumentException {

    public InvalidCacheKeyException(String message) {
        super(message);
    }
}
