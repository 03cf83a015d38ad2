package com.github.dimitryivaniuta.metergateway.gateway.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one admission check.
 *
 * @param allowed   whether the request was admitted (and recorded)
 * @param limit     configured N
 * @param remaining admissions left in the current window after this check
 * @param resetAt   when the oldest admission in the window falls out of range
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, Instant resetAt) {

    public static RateLimitDecision allow(int limit, int remaining, Instant resetAt) {
        return new RateLimitDecision(true, limit, Math.max(0, remaining), resetAt);
    }

    public static RateLimitDecision deny(int limit, Instant resetAt) {
        return new RateLimitDecision(false, limit, 0, resetAt);
    }

    /** Whole seconds until {@link #resetAt()}, at least 1. */
    public long retryAfterSeconds(Instant now) {
        long millis = Duration.between(now, resetAt).toMillis();
        long seconds = (millis + 999) / 1000;
        return Math.max(1L, seconds);
    }
}
