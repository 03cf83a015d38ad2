package com.github.dimitryivaniuta.metergateway.gateway.auth;

import java.time.Instant;

/**
 * Issued session token. {@code value} is opaque to callers.
 */
public record SessionToken(String value, Instant issuedAt, Instant expiresAt) {

    @Override
    public String toString() {
        return "SessionToken[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
