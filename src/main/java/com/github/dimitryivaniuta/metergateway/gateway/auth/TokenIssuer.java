package com.github.dimitryivaniuta.metergateway.gateway.auth;

import java.time.Duration;

@FunctionalInterface
public interface TokenIssuer {

    SessionToken create(String principalId, String secret, Duration ttl);
}
