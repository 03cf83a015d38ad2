package com.github.dimitryivaniuta.metergateway.config;

import com.github.dimitryivaniuta.metergateway.gateway.error.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup validation of {@link GatewayProperties}. Collects every violation and fails once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayConfigurationValidator implements InitializingBean {

    private final GatewayProperties properties;

    @Override
    public void afterPropertiesSet() {
        List<String> errors = validate(properties);
        if (!errors.isEmpty()) {
            errors.forEach(e -> log.error("Invalid configuration: {}", e));
            throw new ConfigurationException("Invalid meter-gateway configuration: " + String.join("; ", errors));
        }
        log.info("meter-gateway configuration validated (mode={})", properties.getMode());
    }

    static List<String> validate(GatewayProperties p) {
        List<String> errors = new ArrayList<>();

        if (p.getMode() == null) errors.add("mode must be set");

        GatewayProperties.Security security = p.getSecurity();
        positive(errors, security.getSessionTtl(), "security.session-ttl");

        GatewayProperties.RateLimit rateLimit = p.getRateLimit();
        if (rateLimit.getLimit() < 1) errors.add("rate-limit.limit must be >= 1");
        if (rateLimit.getWindow() == null || rateLimit.getWindow().compareTo(Duration.ofSeconds(1)) < 0) {
            errors.add("rate-limit.window must be >= 1s");
        }

        GatewayProperties.FastTier fast = p.getCache().getFastTier();
        GatewayProperties.PersistentTier persistent = p.getCache().getPersistentTier();
        if (fast.getCapacity() < 1) errors.add("cache.fast-tier.capacity must be >= 1");
        positive(errors, fast.getTtl(), "cache.fast-tier.ttl");
        positive(errors, persistent.getTtl(), "cache.persistent-tier.ttl");
        positive(errors, persistent.getTimeout(), "cache.persistent-tier.timeout");
        positive(errors, persistent.getMaintenanceTimeout(), "cache.persistent-tier.maintenance-timeout");
        if (fast.getTtl() != null && persistent.getTtl() != null && fast.getTtl().compareTo(persistent.getTtl()) > 0) {
            errors.add("cache.fast-tier.ttl must not exceed cache.persistent-tier.ttl");
        }
        if (persistent.getMaxEntries() < 1) errors.add("cache.persistent-tier.max-entries must be >= 1");
        if (persistent.getIoThreads() < 1) errors.add("cache.persistent-tier.io-threads must be >= 1");

        GatewayProperties.CircuitBreaker cb = persistent.getCircuitBreaker();
        if (cb.getFailureRateThreshold() <= 0 || cb.getFailureRateThreshold() > 100) {
            errors.add("cache.persistent-tier.circuit-breaker.failure-rate-threshold must be in (0, 100]");
        }
        if (cb.getSlidingWindowSize() < 1) errors.add("cache.persistent-tier.circuit-breaker.sliding-window-size must be >= 1");
        positive(errors, cb.getWaitDurationInOpenState(), "cache.persistent-tier.circuit-breaker.wait-duration-in-open-state");

        GatewayProperties.Maintenance maintenance = p.getMaintenance();
        positive(errors, maintenance.getSweepInterval(), "maintenance.sweep-interval");
        positive(errors, maintenance.getStatsInterval(), "maintenance.stats-interval");
        if (maintenance.getBatchSize() < 1) errors.add("maintenance.batch-size must be >= 1");

        return errors;
    }

    private static void positive(List<String> errors, Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            errors.add(name + " must be positive");
        }
    }
}
