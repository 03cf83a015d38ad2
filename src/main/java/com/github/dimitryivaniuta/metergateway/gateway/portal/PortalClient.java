package com.github.dimitryivaniuta.metergateway.gateway.portal;

import java.util.concurrent.CompletionStage;

/**
 * Utility-portal collaborator. Implementations may block internally; callers only see the stage.
 */
public interface PortalClient {

    /**
     * Completes normally when the portal accepts the credentials. Completes exceptionally with
     * {@link PortalLoginException} when it rejects them and with {@link PortalUnavailableException}
     * when it cannot be reached.
     */
    CompletionStage<Void> verifyLogin(String username, String password);
}
