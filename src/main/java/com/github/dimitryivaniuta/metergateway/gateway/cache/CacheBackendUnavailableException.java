package com.github.dimitryivaniuta.metergateway.gateway.cache;

import lombok.Getter;

/**
 * Persistent tier failed, timed out or is short-circuited. Recovered inside {@link TierCache}
 * by degrading to fast-tier-only behavior; never reaches the request boundary.
 */
@Getter
public class CacheBackendUnavailableException extends RuntimeException {

    private final String operation;

    public CacheBackendUnavailableException(String operation, String message, Throwable cause) {
        super("Persistent cache tier unavailable during " + operation + ": " + message, cause);
        this.operation = operation;
    }
}
