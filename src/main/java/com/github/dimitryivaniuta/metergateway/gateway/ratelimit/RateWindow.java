package com.github.dimitryivaniuta.metergateway.gateway.ratelimit;

import java.util.ArrayDeque;

/**
 * Per-principal sliding log. All access happens while holding this object's monitor.
 * Holds at most {@code limit} timestamps (epoch millis) since only admissions are recorded.
 */
final class RateWindow {

    private final ArrayDeque<Long> admissions;
    private long lastCheckMillis;
    private boolean retired;

    RateWindow(int limit, long nowMillis) {
        this.admissions = new ArrayDeque<>(limit);
        this.lastCheckMillis = nowMillis;
    }

    /** Drops admissions at or before {@code nowMillis - windowMillis}. */
    void prune(long nowMillis, long windowMillis) {
        long cutoff = nowMillis - windowMillis;
        while (!admissions.isEmpty() && admissions.peekFirst() <= cutoff) {
            admissions.pollFirst();
        }
    }

    int count() {
        return admissions.size();
    }

    void record(long nowMillis) {
        admissions.addLast(nowMillis);
    }

    /** Oldest admission still in the window, or {@code fallback} when empty. */
    long oldestOr(long fallback) {
        Long oldest = admissions.peekFirst();
        return oldest == null ? fallback : oldest;
    }

    void touch(long nowMillis) {
        lastCheckMillis = Math.max(lastCheckMillis, nowMillis);
    }

    boolean idleLongerThan(long nowMillis, long windowMillis) {
        return nowMillis - lastCheckMillis > windowMillis;
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }
}
