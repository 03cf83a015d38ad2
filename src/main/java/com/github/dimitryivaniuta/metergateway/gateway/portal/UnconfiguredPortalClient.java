package com.github.dimitryivaniuta.metergateway.gateway.portal;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Registered when no real portal integration is on the classpath. Every login fails as unavailable.
 */
public class UnconfiguredPortalClient implements PortalClient {

    @Override
    public CompletionStage<Void> verifyLogin(String username, String password) {
        return CompletableFuture.failedFuture(new PortalUnavailableException("No utility portal client is configured"));
    }
}
