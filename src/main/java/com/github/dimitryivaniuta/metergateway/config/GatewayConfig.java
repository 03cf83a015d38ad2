package com.github.dimitryivaniuta.metergateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.metergateway.gateway.GatewayFacade;
import com.github.dimitryivaniuta.metergateway.gateway.auth.CredentialVault;
import com.github.dimitryivaniuta.metergateway.gateway.cache.TierCache;
import com.github.dimitryivaniuta.metergateway.gateway.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.metergateway.gateway.portal.PortalClient;
import com.github.dimitryivaniuta.metergateway.gateway.portal.UnconfiguredPortalClient;
import com.github.dimitryivaniuta.metergateway.gateway.ratelimit.SlidingWindowRateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.time.Clock;

/**
 * Wires the request-path components: token vault, rate limiter and the facade over them.
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
@DependsOn("gatewayConfigurationValidator")
public class GatewayConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GatewayMetrics gatewayMetrics(MeterRegistry registry) {
        return new GatewayMetrics(registry);
    }

    @Bean
    public CredentialVault credentialVault(GatewayProperties properties, Clock clock, ObjectMapper objectMapper) {
        return CredentialVault.fromSecret(
                properties.getSecurity().getSecretKey(),
                properties.isProduction(),
                clock,
                objectMapper
        );
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public SlidingWindowRateLimiter slidingWindowRateLimiter(GatewayProperties properties, Clock clock) {
        GatewayProperties.RateLimit rl = properties.getRateLimit();
        return new SlidingWindowRateLimiter(rl.getLimit(), rl.getWindow(), clock);
    }

    @Bean
    public GatewayFacade gatewayFacade(CredentialVault vault,
                                       SlidingWindowRateLimiter rateLimiter,
                                       TierCache tierCache,
                                       GatewayMetrics metrics,
                                       Clock clock,
                                       GatewayProperties properties) {
        return new GatewayFacade(vault, vault, rateLimiter, tierCache, metrics, clock,
                properties.getSecurity().getSessionTtl());
    }

    @Bean
    @ConditionalOnMissingBean(PortalClient.class)
    public PortalClient portalClient() {
        return new UnconfiguredPortalClient();
    }
}
