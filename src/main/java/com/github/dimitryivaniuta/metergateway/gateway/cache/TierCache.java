package com.github.dimitryivaniuta.metergateway.gateway.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.metergateway.gateway.lifecycle.LifecycleGuard;
import com.github.dimitryivaniuta.metergateway.gateway.metrics.GatewayMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Two-tier cache: a bounded in-process {@link FastTier} in front of a {@link PersistentTier}.
 *
 * <p>Reads check the fast tier lock-free. A fast-tier miss takes the key's stripe lock, re-checks,
 * then reads the persistent tier and promotes the value with the fast tier's own TTL. Writes hold
 * the same stripe lock and go to the persistent tier first, so the fast tier never holds a value the
 * persistent tier has not been asked to store.
 *
 * <p>Every persistent-tier call runs on {@code ioExecutor} with a timeout behind a circuit breaker.
 * When it fails the operation degrades to fast-tier-only behavior and the caller is not affected.
 *
 * <p>Each write carries a sequence number and the persistent tier keeps the highest one, so a write
 * that lands after its timeout cannot replace a newer value. A key whose last write did not land is
 * fenced: its persistent copy is not read until the write completes, or until the sweep deletes the
 * copy. A pattern invalidation bumps an epoch; a promotion that overlaps it is rolled back.
 */
@Slf4j
public class TierCache implements ResponseCache, AutoCloseable {

    static final String TIER_FAST = "fast";
    static final String TIER_PERSISTENT = "persistent";

    private final TierCacheSettings settings;
    private final PersistentTier persistent;
    private final Executor ioExecutor;
    private final CircuitBreaker circuitBreaker;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final GatewayMetrics metrics;

    private final FastTier fastTier;
    private final StripedLocks locks;
    private final LifecycleGuard guard = new LifecycleGuard("TierCache");

    private final LongAdder hitsTier1 = new LongAdder();
    private final LongAdder hitsTier2 = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder promotions = new LongAdder();
    private final LongAdder sets = new LongAdder();
    private final LongAdder degradedOperations = new LongAdder();
    private final LongAdder persistentEvictions = new LongAdder();

    private final AtomicLong writeSeq = new AtomicLong();
    private final AtomicLong invalidationEpoch = new AtomicLong();
    // keys whose latest persistent write has not landed; guarded by the key's stripe lock
    private final Map<String, UnsettledWrite> unsettled = new ConcurrentHashMap<>();

    private record UnsettledWrite(long writeSeq, CompletableFuture<?> write) {

        boolean landed() {
            return write.isDone() && !write.isCompletedExceptionally();
        }
    }

    public TierCache(TierCacheSettings settings,
                     PersistentTier persistent,
                     Executor ioExecutor,
                     CircuitBreaker circuitBreaker,
                     ObjectMapper objectMapper,
                     Clock clock,
                     GatewayMetrics metrics) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.persistent = Objects.requireNonNull(persistent, "persistent must not be null");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.fastTier = new FastTier(settings.fastTierCapacity(), clock);
        this.locks = new StripedLocks(settings.lockStripes());
    }

    public void start() {
        if (guard.markReady()) {
            log.info("TierCache ready: fastTier.capacity={}, fastTier.ttl={}, persistentTier.ttl={}, persistentTier.maxEntries={}, lockStripes={}",
                    settings.fastTierCapacity(), settings.fastTierTtl(), settings.persistentTierTtl(),
                    settings.persistentMaxEntries(), locks.stripes());
        }
    }

    @Override
    public void close() {
        if (guard.markClosed()) {
            fastTier.clear();
            log.info("TierCache closed");
        }
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        guard.ensureReady();
        CacheKeys.requireValidKey(key);
        Objects.requireNonNull(type, "type must not be null");

        Optional<T> fast = fastTier.get(key).flatMap(e -> convert(key, e.value, type));
        if (fast.isPresent()) {
            recordFastHit();
            return fast;
        }

        Lock lock = locks.forKey(key);
        lock.lock();
        try {
            fast = fastTier.get(key).flatMap(e -> convert(key, e.value, type));
            if (fast.isPresent()) {
                recordFastHit();
                return fast;
            }

            if (!fenced(key)) {
                long epoch = invalidationEpoch.get();
                Optional<T> stored = readPersistent(key, type);
                if (stored.isPresent()) {
                    if (promote(key, stored.get(), epoch)) {
                        hitsTier2.increment();
                        promotions.increment();
                        metrics.cacheHit(TIER_PERSISTENT);
                        log.debug("Promoted key={} to fast tier", key);
                        return stored;
                    }
                    log.debug("Dropped promotion of key={}: invalidated during the read", key);
                }
            }
        } finally {
            lock.unlock();
        }

        misses.increment();
        metrics.cacheMiss();
        return Optional.empty();
    }

    @Override
    public void set(String key, Object value) {
        set(key, value, settings.fastTierTtl(), settings.persistentTierTtl());
    }

    @Override
    public void set(String key, Object value, Duration fastTierTtl, Duration persistentTierTtl) {
        guard.ensureReady();
        CacheKeys.requireValidKey(key);
        Objects.requireNonNull(value, "value must not be null");
        TierCacheSettings.requirePositive(fastTierTtl, "fastTierTtl");
        TierCacheSettings.requirePositive(persistentTierTtl, "persistentTierTtl");

        String payload = serialize(key, value);

        Lock lock = locks.forKey(key);
        lock.lock();
        try {
            Instant now = clock.instant();
            StoredEntry entry = new StoredEntry(key, payload, now, now.plus(persistentTierTtl), nextWriteSeq());
            CompletableFuture<Void> write = null;
            long started = System.nanoTime();
            try {
                write = submit("set", () -> {
                    persistent.put(entry);
                    return null;
                });
                await("set", write, settings.persistentTimeout(), started);
                unsettled.remove(key);
            } catch (CacheBackendUnavailableException e) {
                unsettled.put(key, new UnsettledWrite(entry.writeSeq(),
                        write != null ? write : CompletableFuture.failedFuture(e)));
                degraded(e);
            }
            fastTier.put(key, value, fastTierTtl);
            sets.increment();
        } finally {
            lock.unlock();
        }
        log.debug("Cached key={} fastTtl={} persistentTtl={}", key, fastTierTtl, persistentTierTtl);
    }

    @Override
    public int invalidate(String keyOrPattern) {
        guard.ensureReady();
        if (keyOrPattern == null || keyOrPattern.isEmpty()) {
            throw new InvalidCacheKeyException("key or pattern must not be empty");
        }

        if (CacheKeys.isPattern(keyOrPattern)) {
            String prefix = CacheKeys.patternPrefix(keyOrPattern);
            invalidationEpoch.incrementAndGet();
            int removed = fastTier.removeByPrefix(prefix);
            try {
                removed += onPersistentTier("invalidate", settings.persistentTimeout(),
                        () -> persistent.deleteByPrefix(prefix));
            } catch (CacheBackendUnavailableException e) {
                degraded(e);
            }
            log.debug("Invalidated pattern={} removed={}", keyOrPattern, removed);
            return removed;
        }

        CacheKeys.requireValidKey(keyOrPattern);
        Lock lock = locks.forKey(keyOrPattern);
        lock.lock();
        try {
            int removed = fastTier.remove(keyOrPattern) ? 1 : 0;
            try {
                if (onPersistentTier("invalidate", settings.persistentTimeout(), () -> persistent.delete(keyOrPattern))) {
                    removed++;
                }
            } catch (CacheBackendUnavailableException e) {
                degraded(e);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** Empties both tiers. Counters are kept. */
    public void clear() {
        guard.ensureReady();
        invalidationEpoch.incrementAndGet();
        fastTier.clear();
        try {
            onPersistentTier("clear", settings.maintenanceTimeout(), () -> {
                persistent.clear();
                return null;
            });
        } catch (CacheBackendUnavailableException e) {
            degraded(e);
        }
        log.info("TierCache cleared");
    }

    @Override
    public CacheStats stats() {
        guard.ensureReady();
        long persistentSize;
        try {
            persistentSize = onPersistentTier("count", settings.persistentTimeout(), persistent::count);
        } catch (CacheBackendUnavailableException e) {
            degraded(e);
            persistentSize = -1;
        }
        return new CacheStats(
                hitsTier1.sum(),
                hitsTier2.sum(),
                misses.sum(),
                promotions.sum(),
                fastTier.evictions() + persistentEvictions.sum(),
                sets.sum(),
                degradedOperations.sum(),
                fastTier.size(),
                persistentSize
        );
    }

    /**
     * One maintenance pass: expire the fast tier, settle fenced keys, delete expired persistent
     * entries, then cull the persistent tier to its configured size. {@code stopRequested} is
     * checked between keys and batches.
     */
    public SweepReport sweep(BooleanSupplier stopRequested) {
        guard.ensureReady();
        long fastExpired = fastTier.sweepExpired();
        long persistentExpired = 0;
        long culled = 0;
        int batch = settings.batchSize();

        try {
            if (settleUnsettledWrites(stopRequested)) {
                return new SweepReport(fastExpired, persistentExpired, culled, true);
            }
            int deleted;
            do {
                if (stopRequested.getAsBoolean()) return new SweepReport(fastExpired, persistentExpired, culled, true);
                Instant now = clock.instant();
                deleted = onPersistentTier("sweep", settings.maintenanceTimeout(), () -> persistent.deleteExpired(now, batch));
                persistentExpired += deleted;
            } while (deleted >= batch);

            do {
                if (stopRequested.getAsBoolean()) return new SweepReport(fastExpired, persistentExpired, culled, true);
                deleted = onPersistentTier("cull", settings.maintenanceTimeout(),
                        () -> persistent.cullOldest(settings.persistentMaxEntries(), batch));
                culled += deleted;
            } while (deleted >= batch);
        } catch (CacheBackendUnavailableException e) {
            degraded(e);
        } finally {
            persistentEvictions.add(persistentExpired + culled);
        }
        return new SweepReport(fastExpired, persistentExpired, culled, false);
    }

    public boolean isReady() {
        return guard.isReady();
    }

    public TierCacheSettings settings() {
        return settings;
    }

    /** Keys currently fenced off from the persistent tier. */
    public int unsettledWrites() {
        return unsettled.size();
    }

    private void recordFastHit() {
        hitsTier1.increment();
        metrics.cacheHit(TIER_FAST);
    }

    private <T> Optional<T> readPersistent(String key, Class<T> type) {
        Optional<StoredEntry> stored;
        try {
            Instant now = clock.instant();
            stored = onPersistentTier("get", settings.persistentTimeout(), () -> persistent.find(key, now));
        } catch (CacheBackendUnavailableException e) {
            degraded(e);
            return Optional.empty();
        }
        if (stored.isEmpty() || stored.get().isExpired(clock.instant())) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(stored.get().payload(), type));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable persistent entry for key={} as {}; treating as miss: {}",
                    key, type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> convert(String key, Object value, Class<T> type) {
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        try {
            return Optional.ofNullable(objectMapper.convertValue(value, type));
        } catch (IllegalArgumentException e) {
            log.warn("Fast-tier value for key={} is not convertible to {}; treating as miss", key, type.getSimpleName());
            return Optional.empty();
        }
    }

    private String serialize(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for key " + key + " is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    private void degraded(CacheBackendUnavailableException e) {
        degradedOperations.increment();
        metrics.cacheDegraded(e.getOperation());
        log.warn("{}; continuing with fast tier only", e.getMessage());
    }

    private long nextWriteSeq() {
        long floor = TimeUnit.MILLISECONDS.toMicros(clock.millis());
        return writeSeq.updateAndGet(prev -> Math.max(prev + 1, floor));
    }

    /** Caller holds the key's stripe lock. */
    private boolean fenced(String key) {
        UnsettledWrite pending = unsettled.get(key);
        if (pending == null) {
            return false;
        }
        if (pending.landed()) {
            unsettled.remove(key, pending);
            return false;
        }
        log.debug("Skipping persistent read of key={}: write {} has not landed", key, pending.writeSeq());
        return true;
    }

    /** Caller holds the key's stripe lock. */
    private boolean promote(String key, Object value, long epoch) {
        if (invalidationEpoch.get() != epoch) {
            return false;
        }
        FastTier.Entry promoted = fastTier.put(key, value, settings.fastTierTtl());
        if (invalidationEpoch.get() != epoch) {
            fastTier.remove(key, promoted);
            return false;
        }
        return true;
    }

    /**
     * Unfences keys whose write has completed. A write that failed may have left an older value
     * behind, so that copy is deleted first.
     *
     * @return true if stopped early
     */
    private boolean settleUnsettledWrites(BooleanSupplier stopRequested) {
        int settled = 0;
        for (String key : unsettled.keySet()) {
            if (stopRequested.getAsBoolean()) return true;
            Lock lock = locks.forKey(key);
            lock.lock();
            try {
                UnsettledWrite pending = unsettled.get(key);
                if (pending == null || !pending.write().isDone()) continue;
                if (!pending.landed()) {
                    onPersistentTier("settle", settings.maintenanceTimeout(), () -> persistent.delete(key));
                }
                unsettled.remove(key, pending);
                settled++;
            } finally {
                lock.unlock();
            }
        }
        if (settled > 0) {
            log.debug("Settled {} fenced keys, {} still pending", settled, unsettled.size());
        }
        return false;
    }

    private <T> T onPersistentTier(String operation, Duration timeout, Supplier<T> call) {
        long started = System.nanoTime();
        return await(operation, submit(operation, call), timeout, started);
    }

    private <T> CompletableFuture<T> submit(String operation, Supplier<T> call) {
        if (!circuitBreaker.tryAcquirePermission()) {
            throw new CacheBackendUnavailableException(operation,
                    "circuit breaker '" + circuitBreaker.getName() + "' is " + circuitBreaker.getState(), null);
        }
        try {
            return CompletableFuture.supplyAsync(call, ioExecutor);
        } catch (RejectedExecutionException e) {
            circuitBreaker.releasePermission();
            throw new CacheBackendUnavailableException(operation, "I/O executor rejected the call", e);
        }
    }

    private <T> T await(String operation, CompletableFuture<T> future, Duration timeout, long started) {
        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            circuitBreaker.onSuccess(System.nanoTime() - started, TimeUnit.NANOSECONDS);
            return result;
        } catch (TimeoutException e) {
            // the task keeps running and the future completes when it does; a late write is ordered by its sequence
            circuitBreaker.onError(System.nanoTime() - started, TimeUnit.NANOSECONDS, e);
            throw new CacheBackendUnavailableException(operation, "timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            circuitBreaker.onError(System.nanoTime() - started, TimeUnit.NANOSECONDS, cause);
            throw new CacheBackendUnavailableException(operation, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuitBreaker.releasePermission();
            throw new CacheBackendUnavailableException(operation, "interrupted", e);
        }
    }
}
