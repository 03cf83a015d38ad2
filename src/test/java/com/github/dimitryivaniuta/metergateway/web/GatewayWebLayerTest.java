package com.github.dimitryivaniuta.metergateway.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.metergateway.gateway.GatewayFacade;
import com.github.dimitryivaniuta.metergateway.gateway.auth.CredentialVault;
import com.github.dimitryivaniuta.metergateway.gateway.auth.SessionToken;
import com.github.dimitryivaniuta.metergateway.gateway.cache.TierCache;
import com.github.dimitryivaniuta.metergateway.gateway.cache.TierCacheSettings;
import com.github.dimitryivaniuta.metergateway.gateway.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.metergateway.gateway.portal.PortalClient;
import com.github.dimitryivaniuta.metergateway.gateway.portal.PortalLoginException;
import com.github.dimitryivaniuta.metergateway.gateway.portal.UnconfiguredPortalClient;
import com.github.dimitryivaniuta.metergateway.gateway.ratelimit.SlidingWindowRateLimiter;
import com.github.dimitryivaniuta.metergateway.support.InMemoryPersistentTier;
import com.github.dimitryivaniuta.metergateway.support.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Controllers, interceptor and exception advice wired together without a Spring context.
 */
class GatewayWebLayerTest {

    private final MutableClock clock = MutableClock.atEpochSeconds(1_700_000_000L);
    private final ObjectMapper om = new ObjectMapper().findAndRegisterModules();
    private final GatewayMetrics metrics = new GatewayMetrics(new SimpleMeterRegistry());
    private final CredentialVault vault = CredentialVault.fromSecret("web-layer-test-secret", false, clock, om);

    private ExecutorService io;
    private SlidingWindowRateLimiter limiter;
    private TierCache cache;
    private GatewayFacade facade;

    @BeforeEach
    void setUp() {
        io = Executors.newSingleThreadExecutor();
        limiter = new SlidingWindowRateLimiter(2, Duration.ofSeconds(60), clock);
        limiter.start();
        cache = new TierCache(TierCacheSettings.builder()
                .fastTierCapacity(100)
                .fastTierTtl(Duration.ofMinutes(15))
                .persistentTierTtl(Duration.ofHours(1))
                .persistentMaxEntries(1_000)
                .persistentTimeout(Duration.ofSeconds(2))
                .maintenanceTimeout(Duration.ofSeconds(5))
                .batchSize(100)
                .lockStripes(16)
                .build(), new InMemoryPersistentTier(), io, CircuitBreaker.ofDefaults("web"), om, clock, metrics);
        cache.start();
        facade = new GatewayFacade(vault, vault, limiter, cache, metrics, clock, Duration.ofHours(24));
    }

    @AfterEach
    void tearDown() {
        cache.close();
        limiter.close();
        io.shutdownNow();
    }

    private MockMvc mvc(PortalClient portal) {
        return MockMvcBuilders
                .standaloneSetup(new AuthController(facade, portal), new CacheController(facade))
                .setControllerAdvice(new GatewayExceptionHandler(clock))
                .addMappedInterceptors(new String[]{"/api/**", "/auth/verify", "/auth/refresh", "/auth/logout"},
                        new GatewayRequestInterceptor(facade))
                .build();
    }

    private String bearer() {
        SessionToken token = facade.issue("acct-1", "pw");
        return "Bearer " + token.value();
    }

    @Test
    void login_shouldIssueTokenWhenPortalAcceptsCredentials() throws Exception {
        PortalClient accepting = (u, p) -> CompletableFuture.completedFuture(null);

        mvc(accepting).perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"acct-1","password":"pw"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").value(startsWith("v1.")))
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.expires_in").value(86400));
    }

    @Test
    void login_rejectedByPortalShouldBe401() throws Exception {
        PortalClient rejecting = (u, p) -> CompletableFuture.failedFuture(new PortalLoginException("Invalid username or password"));

        mvc(rejecting).perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"acct-1","password":"wrong"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.error_code").value("AUTHENTICATION_FAILED"))
                .andExpect(jsonPath("$.detail").value("Invalid username or password"));
    }

    @Test
    void login_withoutPortalShouldBe503() throws Exception {
        mvc(new UnconfiguredPortalClient()).perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"acct-1","password":"pw"}
                                """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_code").value("PORTAL_UNAVAILABLE"));
    }

    @Test
    void login_blankFieldsShouldBe400() throws Exception {
        mvc(new UnconfiguredPortalClient()).perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"","password":"pw"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void verify_shouldRequireBearerToken() throws Exception {
        mvc(new UnconfiguredPortalClient()).perform(get("/auth/verify"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.error_code").value("AUTHENTICATION_REQUIRED"));
    }

    @Test
    void verify_shouldDistinguishMalformedAndExpiredTokens() throws Exception {
        MockMvc mvc = mvc(new UnconfiguredPortalClient());
        mvc.perform(get("/auth/verify").header("Authorization", "Bearer not-a-token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("TOKEN_MALFORMED"));

        String auth = bearer();
        clock.advance(Duration.ofHours(25));
        mvc.perform(get("/auth/verify").header("Authorization", auth))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("TOKEN_EXPIRED"));
    }

    @Test
    void verify_shouldReturnPrincipalAndRateLimitHeaders() throws Exception {
        mvc(new UnconfiguredPortalClient()).perform(get("/auth/verify").header("Authorization", bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.principal_id").value("acct-1"))
                .andExpect(header().string("X-RateLimit-Limit", "2"))
                .andExpect(header().string("X-RateLimit-Remaining", "1"))
                .andExpect(header().string("X-RateLimit-Reset", String.valueOf(clock.instant().getEpochSecond() + 60)));
    }

    @Test
    void overLimit_shouldBe429WithRetryAfter() throws Exception {
        MockMvc mvc = mvc(new UnconfiguredPortalClient());
        String auth = bearer();
        mvc.perform(get("/api/cache/stats").header("Authorization", auth)).andExpect(status().isOk());
        mvc.perform(get("/api/cache/stats").header("Authorization", auth)).andExpect(status().isOk());
        clock.advanceSeconds(20);

        mvc.perform(get("/api/cache/stats").header("Authorization", auth))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "40"))
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(jsonPath("$.error_code").value("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    void refresh_shouldReturnNewToken() throws Exception {
        mvc(new UnconfiguredPortalClient()).perform(post("/auth/refresh").header("Authorization", bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").value(startsWith("v1.")));
    }

    @Test
    void logout_shouldAcknowledge() throws Exception {
        mvc(new UnconfiguredPortalClient()).perform(post("/auth/logout").header("Authorization", bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    void cacheEndpoints_shouldReportAndInvalidate() throws Exception {
        cache.set("meter:42:unit", 17.5);
        cache.set("meter:7:unit", 1.0);
        MockMvc mvc = mvc(new UnconfiguredPortalClient());
        String auth = bearer();

        mvc.perform(delete("/api/cache").param("pattern", "meter:42:*").header("Authorization", auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(2));

        mvc.perform(get("/api/cache/stats").header("Authorization", auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sets").value(2))
                .andExpect(jsonPath("$.fast_tier_size").value(1));
    }

    @Test
    void invalidPattern_shouldBe400() throws Exception {
        mvc(new UnconfiguredPortalClient()).perform(delete("/api/cache").param("pattern", "meter:*:unit").header("Authorization", bearer()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
    }

    @Test
    void internalIllegalArgument_shouldBe500WithoutDetail() throws Exception {
        MockMvc mvc = MockMvcBuilders
                .standaloneSetup(new FailingController())
                .setControllerAdvice(new GatewayExceptionHandler(clock))
                .build();

        mvc.perform(get("/internal/serialize"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.detail").value("Internal server error"));
    }

    @RestController
    static class FailingController {

        @GetMapping("/internal/serialize")
        String serialize() {
            throw new IllegalArgumentException("Value for key meter:1 is not JSON-serializable: no serializer found");
        }
    }
}
