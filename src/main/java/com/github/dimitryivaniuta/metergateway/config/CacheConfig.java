package com.github.dimitryivaniuta.metergateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.metergateway.gateway.cache.PersistentTier;
import com.github.dimitryivaniuta.metergateway.gateway.cache.TierCache;
import com.github.dimitryivaniuta.metergateway.gateway.cache.TierCacheSettings;
import com.github.dimitryivaniuta.metergateway.gateway.cache.jpa.CacheEntryRecordRepository;
import com.github.dimitryivaniuta.metergateway.gateway.cache.jpa.JpaPersistentTier;
import com.github.dimitryivaniuta.metergateway.gateway.maintenance.MaintenanceScheduler;
import com.github.dimitryivaniuta.metergateway.gateway.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.metergateway.gateway.ratelimit.SlidingWindowRateLimiter;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Two-tier cache wiring:
 * - Caffeine fast tier inside {@link TierCache}
 * - PostgreSQL persistent tier (JPA), called only from a dedicated I/O pool
 * - Resilience4j circuit breaker in front of the persistent tier
 */
@Slf4j
@Configuration
public class CacheConfig {

    static final String PERSISTENT_TIER = "persistent-tier";

    @Bean
    public PersistentTier persistentTier(CacheEntryRecordRepository repository) {
        return new JpaPersistentTier(repository);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService persistentTierIoExecutor(GatewayProperties properties) {
        int threads = properties.getCache().getPersistentTier().getIoThreads();
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(PERSISTENT_TIER + "-io-");
        threadFactory.setDaemon(true);
        // bounded queue: a saturated pool rejects, and the cache degrades instead of queueing forever
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(threads * 256), threadFactory, new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public CircuitBreaker persistentTierCircuitBreaker(GatewayProperties properties) {
        GatewayProperties.CircuitBreaker cb = properties.getCache().getPersistentTier().getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(cb.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cb.getSlidingWindowSize())
                .minimumNumberOfCalls(Math.min(cb.getMinimumNumberOfCalls(), cb.getSlidingWindowSize()))
                .waitDurationInOpenState(cb.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(cb.getPermittedCallsInHalfOpenState())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
        CircuitBreaker breaker = CircuitBreaker.of(PERSISTENT_TIER, config);
        breaker.getEventPublisher().onStateTransition(e ->
                log.warn("Circuit breaker '{}' {}", e.getCircuitBreakerName(), e.getStateTransition()));
        return breaker;
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public TierCache tierCache(GatewayProperties properties,
                               PersistentTier persistentTier,
                               ExecutorService persistentTierIoExecutor,
                               CircuitBreaker persistentTierCircuitBreaker,
                               ObjectMapper objectMapper,
                               Clock clock,
                               GatewayMetrics metrics) {
        GatewayProperties.FastTier fast = properties.getCache().getFastTier();
        GatewayProperties.PersistentTier persistent = properties.getCache().getPersistentTier();
        TierCacheSettings settings = TierCacheSettings.builder()
                .fastTierCapacity(fast.getCapacity())
                .fastTierTtl(fast.getTtl())
                .persistentTierTtl(persistent.getTtl())
                .persistentMaxEntries(persistent.getMaxEntries())
                .persistentTimeout(persistent.getTimeout())
                .maintenanceTimeout(persistent.getMaintenanceTimeout())
                .batchSize(properties.getMaintenance().getBatchSize())
                .lockStripes(256)
                .build();
        return new TierCache(settings, persistentTier, persistentTierIoExecutor, persistentTierCircuitBreaker,
                objectMapper, clock, metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "meter-gateway.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MaintenanceScheduler maintenanceScheduler(TierCache tierCache,
                                                     SlidingWindowRateLimiter rateLimiter,
                                                     GatewayMetrics metrics,
                                                     GatewayProperties properties) {
        GatewayProperties.Maintenance m = properties.getMaintenance();
        return new MaintenanceScheduler(tierCache, rateLimiter, metrics, m.getSweepInterval(), m.getStatsInterval());
    }
}
