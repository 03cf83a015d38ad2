package com.github.dimitryivaniuta.metergateway.gateway.ratelimit;

import com.github.dimitryivaniuta.metergateway.gateway.lifecycle.LifecycleGuard;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Exact sliding-log rate limiter: at most {@code limit} admissions per principal in any
 * trailing interval of length {@code window}.
 *
 * <p>Memory is O(limit) per active principal. Each principal's window is guarded by its own monitor,
 * so unrelated principals never contend. Windows retired by {@link #evictIdle} are never written again;
 * a caller that races with retirement re-resolves a fresh window.
 */
@Slf4j
public final class SlidingWindowRateLimiter implements AdmissionPolicy, AutoCloseable {

    private final int limit;
    private final long windowMillis;
    private final Clock clock;
    private final LifecycleGuard guard = new LifecycleGuard("RateLimiter");

    private final Map<String, RateWindow> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(int limit, Duration window, Clock clock) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be >= 1");
        if (window == null || window.toMillis() <= 0) throw new IllegalArgumentException("window must be >= 1ms");
        this.limit = limit;
        this.windowMillis = window.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void start() {
        if (guard.markReady()) {
            log.info("Rate limiter ready: {} requests per {} ms (sliding log)", limit, windowMillis);
        }
    }

    @Override
    public void close() {
        if (guard.markClosed()) {
            windows.clear();
            log.info("Rate limiter closed");
        }
    }

    @Override
    public RateLimitDecision allow(String principalId) {
        guard.ensureReady();
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("principalId must not be blank");
        }

        while (true) {
            long now = clock.millis();
            RateWindow window = windows.computeIfAbsent(principalId, k -> new RateWindow(limit, now));
            synchronized (window) {
                if (window.isRetired()) {
                    // evicted between lookup and lock; the map no longer holds it
                    continue;
                }
                long current = Math.max(now, clock.millis());
                window.touch(current);
                window.prune(current, windowMillis);

                int count = window.count();
                if (count < limit) {
                    window.record(current);
                    Instant resetAt = Instant.ofEpochMilli(window.oldestOr(current) + windowMillis);
                    return RateLimitDecision.allow(limit, limit - count - 1, resetAt);
                }

                Instant resetAt = Instant.ofEpochMilli(window.oldestOr(current) + windowMillis);
                log.debug("Rate limit denied for principal {} until {}", principalId, resetAt);
                return RateLimitDecision.deny(limit, resetAt);
            }
        }
    }

    /**
     * Removes windows idle for longer than the window length. Checks {@code stopRequested}
     * between principals; each removal is atomic under the window's monitor.
     *
     * @return number of windows removed
     */
    public int evictIdle(BooleanSupplier stopRequested) {
        guard.ensureReady();
        long now = clock.millis();
        int removed = 0;
        for (Map.Entry<String, RateWindow> e : windows.entrySet()) {
            if (stopRequested.getAsBoolean()) break;
            RateWindow window = e.getValue();
            synchronized (window) {
                if (!window.isRetired() && window.idleLongerThan(now, windowMillis)) {
                    window.retire();
                    windows.remove(e.getKey(), window);
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} idle rate windows", removed);
        }
        return removed;
    }

    public int windowCount() {
        return windows.size();
    }

    public int limit() {
        return limit;
    }

    public Duration window() {
        return Duration.ofMillis(windowMillis);
    }
}
