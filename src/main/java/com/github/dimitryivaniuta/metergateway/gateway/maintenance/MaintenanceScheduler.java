package com.github.dimitryivaniuta.metergateway.gateway.maintenance;

import com.github.dimitryivaniuta.metergateway.gateway.cache.CacheStats;
import com.github.dimitryivaniuta.metergateway.gateway.cache.SweepReport;
import com.github.dimitryivaniuta.metergateway.gateway.cache.TierCache;
import com.github.dimitryivaniuta.metergateway.gateway.lifecycle.ComponentState;
import com.github.dimitryivaniuta.metergateway.gateway.lifecycle.LifecycleGuard;
import com.github.dimitryivaniuta.metergateway.gateway.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.metergateway.gateway.ratelimit.SlidingWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the periodic sweep (cache expiry, persistent cull, idle rate windows) and the stats snapshot.
 *
 * <p>Both tasks share a single scheduler thread, so they never overlap. {@link #stop()} raises the
 * stop signal that the sweep checks between batches, cancels future runs and waits for the
 * in-flight run to return. A later {@link #start()} builds a new task scheduler, so the bean follows
 * a Spring context stop/start.
 */
@Slf4j
public class MaintenanceScheduler implements SmartLifecycle {

    public record SweepResult(SweepReport cache, int idleWindowsEvicted) {}

    private static final String COMPONENT = "MaintenanceScheduler";

    private final TierCache cache;
    private final SlidingWindowRateLimiter rateLimiter;
    private final GatewayMetrics metrics;
    private final Duration sweepInterval;
    private final Duration statsInterval;

    // replaced on restart; a stopped scheduler reports CLOSED until started again
    private volatile LifecycleGuard guard = new LifecycleGuard(COMPONENT);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();

    private ThreadPoolTaskScheduler taskScheduler;

    public MaintenanceScheduler(TierCache cache,
                                SlidingWindowRateLimiter rateLimiter,
                                GatewayMetrics metrics,
                                Duration sweepInterval,
                                Duration statsInterval) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.sweepInterval = requirePositive(sweepInterval, "sweepInterval");
        this.statsInterval = requirePositive(statsInterval, "statsInterval");
    }

    @Override
    public synchronized void start() {
        if (guard.state() == ComponentState.CLOSED) {
            guard = new LifecycleGuard(COMPONENT);
        }
        if (!guard.markReady()) return;
        stopRequested.set(false);

        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("gateway-maintenance-");
        taskScheduler.setWaitForTasksToCompleteOnShutdown(true);
        taskScheduler.setAwaitTerminationSeconds(60);
        taskScheduler.setRemoveOnCancelPolicy(true);
        taskScheduler.initialize();

        Instant now = Instant.now();
        futures.add(taskScheduler.scheduleWithFixedDelay(this::sweepTask, now.plus(sweepInterval), sweepInterval));
        futures.add(taskScheduler.scheduleWithFixedDelay(this::snapshotTask, now.plus(statsInterval), statsInterval));
        log.info("Maintenance scheduler started: sweepInterval={}, statsInterval={}", sweepInterval, statsInterval);
    }

    @Override
    public synchronized void stop() {
        if (!guard.markClosed()) return;
        stopRequested.set(true);
        futures.forEach(f -> f.cancel(false));
        futures.clear();
        if (taskScheduler != null) {
            // waits for the in-flight run
            taskScheduler.shutdown();
            taskScheduler = null;
        }
        log.info("Maintenance scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return guard.isReady();
    }

    /** Runs one sweep on the calling thread. */
    public SweepResult runSweepNow() {
        guard.ensureReady();
        long started = System.nanoTime();
        SweepReport report = cache.sweep(stopRequested::get);
        int evicted = report.interrupted() ? 0 : rateLimiter.evictIdle(stopRequested::get);
        long tookMs = (System.nanoTime() - started) / 1_000_000;

        if (report.interrupted()) {
            log.info("Sweep interrupted by shutdown after {} ms: {}", tookMs, report);
        } else {
            log.info("Sweep finished in {} ms: fastExpired={}, persistentExpired={}, persistentCulled={}, idleWindows={}",
                    tookMs, report.fastTierExpired(), report.persistentTierExpired(), report.persistentTierCulled(), evicted);
        }
        return new SweepResult(report, evicted);
    }

    /** Logs and publishes one stats snapshot on the calling thread. */
    public CacheStats snapshotStatsNow() {
        guard.ensureReady();
        CacheStats stats = cache.stats();
        int windows = rateLimiter.windowCount();
        metrics.recordSnapshot(stats, windows);
        log.info("Gateway stats: hitsTier1={}, hitsTier2={}, misses={}, hitRate={}%, promotions={}, evictions={}, sets={}, degraded={}, fastTierSize={}, persistentTierSize={}, rateWindows={}",
                stats.hitsTier1(), stats.hitsTier2(), stats.misses(), stats.hitRatePercent(), stats.promotions(),
                stats.evictions(), stats.sets(), stats.degradedOperations(), stats.fastTierSize(),
                stats.persistentTierSize(), windows);
        return stats;
    }

    private void sweepTask() {
        if (stopRequested.get()) return;
        try {
            runSweepNow();
        } catch (RuntimeException e) {
            log.error("Maintenance sweep failed; next run in {}", sweepInterval, e);
        }
    }

    private void snapshotTask() {
        if (stopRequested.get()) return;
        try {
            snapshotStatsNow();
        } catch (RuntimeException e) {
            log.error("Stats snapshot failed; next run in {}", statsInterval, e);
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return d;
    }
}
