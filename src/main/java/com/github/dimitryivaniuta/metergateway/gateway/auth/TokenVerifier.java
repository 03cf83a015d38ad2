package com.github.dimitryivaniuta.metergateway.gateway.auth;

@FunctionalInterface
public interface TokenVerifier {

    /**
     * @throws GatewayAuthenticationException with reason MALFORMED, SIGNATURE_INVALID or EXPIRED
     */
    GatewayPrincipal verify(String token);
}
