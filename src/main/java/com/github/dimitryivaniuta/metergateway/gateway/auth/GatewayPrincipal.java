package com.github.dimitryivaniuta.metergateway.gateway.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Caller identity recovered from a verified session token. Lives only as long as the request.
 *
 * @param id        portal account identifier
 * @param secret    portal secret, decrypted from the token
 * @param expiresAt expiry of the token this principal was recovered from
 */
public record GatewayPrincipal(String id, String secret, Instant expiresAt) {

    public GatewayPrincipal {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(secret, "secret must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    @Override
    public String toString() {
        return "GatewayPrincipal[id=" + id + ", secret=***, expiresAt=" + expiresAt + "]";
    }
}
