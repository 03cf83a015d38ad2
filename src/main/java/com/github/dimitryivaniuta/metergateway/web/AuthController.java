package com.github.dimitryivaniuta.metergateway.web;

import com.github.dimitryivaniuta.metergateway.gateway.GatewayFacade;
import com.github.dimitryivaniuta.metergateway.gateway.auth.GatewayPrincipal;
import com.github.dimitryivaniuta.metergateway.gateway.error.GatewayException;
import com.github.dimitryivaniuta.metergateway.gateway.portal.PortalClient;
import com.github.dimitryivaniuta.metergateway.gateway.portal.PortalUnavailableException;
import com.github.dimitryivaniuta.metergateway.web.dto.LoginRequest;
import com.github.dimitryivaniuta.metergateway.web.dto.MessageResponse;
import com.github.dimitryivaniuta.metergateway.web.dto.TokenResponse;
import com.github.dimitryivaniuta.metergateway.web.dto.TokenVerifyResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Session token endpoints. {@code /auth/login} is public; the others pass through
 * {@link GatewayRequestInterceptor} and receive the verified principal.
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    static final long PORTAL_LOGIN_TIMEOUT_SECONDS = 30;

    private final GatewayFacade facade;
    private final PortalClient portalClient;

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        verifyWithPortal(request.username(), request.password());
        return TokenResponse.from(facade.issue(request.username(), request.password()));
    }

    @GetMapping("/verify")
    public TokenVerifyResponse verify(@RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) GatewayPrincipal principal) {
        return new TokenVerifyResponse(true, principal.id(), principal.expiresAt());
    }

    @PostMapping("/refresh")
    public TokenResponse refresh(@RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) GatewayPrincipal principal) {
        return TokenResponse.from(facade.refresh(principal));
    }

    /** Tokens are stateless; the client discards its copy. */
    @PostMapping("/logout")
    public MessageResponse logout(@RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) GatewayPrincipal principal) {
        log.info("Logout acknowledged for principal={}", principal.id());
        return new MessageResponse("Logged out. Discard the token on the client.");
    }

    private void verifyWithPortal(String username, String password) {
        try {
            portalClient.verifyLogin(username, password)
                    .toCompletableFuture()
                    .get(PORTAL_LOGIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof GatewayException ge) {
                throw ge;
            }
            throw new PortalUnavailableException("Utility portal login failed", e.getCause());
        } catch (TimeoutException e) {
            throw new PortalUnavailableException("Utility portal did not answer in time", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PortalUnavailableException("Interrupted while waiting for the utility portal", e);
        }
    }
}
