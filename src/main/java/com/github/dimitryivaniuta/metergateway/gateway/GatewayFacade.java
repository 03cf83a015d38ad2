package com.github.dimitryivaniuta.metergateway.gateway;

import com.github.dimitryivaniuta.metergateway.gateway.auth.AuthenticationFailure;
import com.github.dimitryivaniuta.metergateway.gateway.auth.GatewayAuthenticationException;
import com.github.dimitryivaniuta.metergateway.gateway.auth.GatewayPrincipal;
import com.github.dimitryivaniuta.metergateway.gateway.auth.SessionToken;
import com.github.dimitryivaniuta.metergateway.gateway.auth.TokenIssuer;
import com.github.dimitryivaniuta.metergateway.gateway.auth.TokenVerifier;
import com.github.dimitryivaniuta.metergateway.gateway.cache.CacheStats;
import com.github.dimitryivaniuta.metergateway.gateway.cache.ResponseCache;
import com.github.dimitryivaniuta.metergateway.gateway.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.metergateway.gateway.ratelimit.AdmissionPolicy;
import com.github.dimitryivaniuta.metergateway.gateway.ratelimit.RateLimitDecision;
import com.github.dimitryivaniuta.metergateway.gateway.ratelimit.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-request contract of the gateway: authenticate, admit, then read-compute-write through the cache.
 * Holds no state of its own.
 */
@Slf4j
public class GatewayFacade {

    private final TokenIssuer tokenIssuer;
    private final TokenVerifier tokenVerifier;
    private final AdmissionPolicy admissionPolicy;
    private final ResponseCache cache;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final Duration sessionTtl;

    public GatewayFacade(TokenIssuer tokenIssuer,
                         TokenVerifier tokenVerifier,
                         AdmissionPolicy admissionPolicy,
                         ResponseCache cache,
                         GatewayMetrics metrics,
                         Clock clock,
                         Duration sessionTtl) {
        this.tokenIssuer = Objects.requireNonNull(tokenIssuer, "tokenIssuer must not be null");
        this.tokenVerifier = Objects.requireNonNull(tokenVerifier, "tokenVerifier must not be null");
        this.admissionPolicy = Objects.requireNonNull(admissionPolicy, "admissionPolicy must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sessionTtl = Objects.requireNonNull(sessionTtl, "sessionTtl must not be null");
    }

    /**
     * @param bearerToken raw token value, without the {@code Bearer } scheme
     * @throws GatewayAuthenticationException MISSING when no token is presented, otherwise the verifier's reason
     */
    public GatewayPrincipal authenticate(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            metrics.authFailure(AuthenticationFailure.MISSING);
            throw new GatewayAuthenticationException(AuthenticationFailure.MISSING, "Authentication required");
        }
        try {
            return tokenVerifier.verify(bearerToken.trim());
        } catch (GatewayAuthenticationException e) {
            metrics.authFailure(e.getReason());
            log.debug("Authentication rejected: {}", e.getReason());
            throw e;
        }
    }

    /**
     * @throws RateLimitExceededException when the principal is over its limit
     */
    public RateLimitDecision admit(GatewayPrincipal principal) {
        Objects.requireNonNull(principal, "principal must not be null");
        RateLimitDecision decision = admissionPolicy.allow(principal.id());
        if (!decision.allowed()) {
            metrics.rateLimitRejected();
            throw new RateLimitExceededException(decision, decision.retryAfterSeconds(clock.instant()));
        }
        metrics.rateLimitAllowed();
        return decision;
    }

    /**
     * Cache-aside with explicit TTLs. {@code compute} runs outside every cache lock; when it throws,
     * nothing is cached and the exception propagates. A {@code null} result is returned but not cached.
     */
    public <T> T cached(String key, Class<T> type, Duration fastTierTtl, Duration persistentTierTtl, Supplier<? extends T> compute) {
        Optional<T> hit = cache.get(key, type);
        if (hit.isPresent()) {
            return hit.get();
        }
        T value = compute.get();
        if (value != null) {
            cache.set(key, value, fastTierTtl, persistentTierTtl);
        }
        return value;
    }

    public <T> T cached(String key, Class<T> type, Supplier<? extends T> compute) {
        Optional<T> hit = cache.get(key, type);
        if (hit.isPresent()) {
            return hit.get();
        }
        T value = compute.get();
        if (value != null) {
            cache.set(key, value);
        }
        return value;
    }

    public SessionToken issue(String principalId, String secret) {
        SessionToken token = tokenIssuer.create(principalId, secret, sessionTtl);
        log.info("Issued session token for principal={} expiresAt={}", principalId, token.expiresAt());
        return token;
    }

    /** New token for an already authenticated principal, with a fresh session TTL. */
    public SessionToken refresh(GatewayPrincipal principal) {
        Objects.requireNonNull(principal, "principal must not be null");
        return tokenIssuer.create(principal.id(), principal.secret(), sessionTtl);
    }

    public int invalidate(String keyOrPattern) {
        return cache.invalidate(keyOrPattern);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public Duration sessionTtl() {
        return sessionTtl;
    }
}
