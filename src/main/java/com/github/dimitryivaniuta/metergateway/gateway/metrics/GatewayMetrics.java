package com.github.dimitryivaniuta.metergateway.gateway.metrics;

import com.github.dimitryivaniuta.metergateway.gateway.auth.AuthenticationFailure;
import com.github.dimitryivaniuta.metergateway.gateway.cache.CacheStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

public class GatewayMetrics {

    private final MeterRegistry registry;

    private final AtomicLong fastTierSize = new AtomicLong();
    private final AtomicLong persistentTierSize = new AtomicLong();
    private final AtomicLong rateWindows = new AtomicLong();

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("meter_gateway_cache_items", fastTierSize, AtomicLong::get)
                .tag("tier", "fast")
                .register(registry);
        Gauge.builder("meter_gateway_cache_items", persistentTierSize, AtomicLong::get)
                .tag("tier", "persistent")
                .register(registry);
        Gauge.builder("meter_gateway_ratelimit_windows", rateWindows, AtomicLong::get)
                .register(registry);
    }

    // ---- Authentication ----
    public void authFailure(AuthenticationFailure reason) {
        Counter.builder("meter_gateway_auth_failures_total")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    // ---- Rate limiting ----
    public void rateLimitAllowed() {
        Counter.builder("meter_gateway_ratelimit_allowed_total")
                .register(registry)
                .increment();
    }

    public void rateLimitRejected() {
        Counter.builder("meter_gateway_ratelimit_rejected_total")
                .register(registry)
                .increment();
    }

    // ---- Cache ----
    public void cacheHit(String tier) {
        Counter.builder("meter_gateway_cache_hits_total")
                .tag("tier", tier) // fast | persistent
                .register(registry)
                .increment();
    }

    public void cacheMiss() {
        Counter.builder("meter_gateway_cache_misses_total")
                .register(registry)
                .increment();
    }

    public void cacheDegraded(String operation) {
        Counter.builder("meter_gateway_cache_degraded_total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    // ---- Snapshots ----
    public void recordSnapshot(CacheStats stats, int windows) {
        fastTierSize.set(stats.fastTierSize());
        if (stats.persistentTierSize() >= 0) {
            persistentTierSize.set(stats.persistentTierSize());
        }
        rateWindows.set(windows);
    }
}
