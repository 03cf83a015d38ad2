package com.github.dimitryivaniuta.metergateway.gateway.ratelimit;

import com.github.dimitryivaniuta.metergateway.gateway.lifecycle.ComponentStateException;
import com.github.dimitryivaniuta.metergateway.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private final MutableClock clock = MutableClock.atEpochSeconds(1_700_000_000L);
    private SlidingWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        limiter = new SlidingWindowRateLimiter(5, Duration.ofSeconds(60), clock);
        limiter.start();
    }

    @AfterEach
    void tearDown() {
        limiter.close();
    }

    @Test
    void allow_shouldAdmitFiveThenDenySixthInsideWindow() {
        Instant first = clock.instant();
        for (int i = 0; i < 5; i++) {
            RateLimitDecision d = limiter.allow("p1");
            assertThat(d.allowed()).isTrue();
            assertThat(d.remaining()).isEqualTo(4 - i);
            assertThat(d.resetAt()).isEqualTo(first.plusSeconds(60));
            clock.advanceSeconds(10);
        }

        RateLimitDecision denied = limiter.allow("p1");

        assertThat(denied.allowed()).isFalse();
        assertThat(denied.remaining()).isZero();
        assertThat(denied.limit()).isEqualTo(5);
        assertThat(denied.resetAt()).isEqualTo(first.plusSeconds(60));
        assertThat(denied.retryAfterSeconds(clock.instant())).isEqualTo(10);
    }

    @Test
    void allow_shouldAdmitAgainOnceFirstCallLeavesWindow() {
        Instant first = clock.instant();
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.allow("p1").allowed()).isTrue();
            clock.advanceSeconds(1);
        }
        clock.advance(Duration.ofMillis(54_999));
        assertThat(limiter.allow("p1").allowed()).isFalse();

        clock.advance(Duration.ofMillis(1));
        RateLimitDecision d = limiter.allow("p1");

        // only the call at t=0 left the window; the four at t=1..4s are still counted
        assertThat(d.allowed()).isTrue();
        assertThat(d.remaining()).isZero();
        assertThat(d.resetAt()).isEqualTo(first.plusSeconds(61));
    }

    @Test
    void allow_shouldNotBurstAtWindowBoundary() {
        // 5 calls at t=50s, then the limiter must still deny at t=61s (a fixed window would reset at 60s)
        clock.advanceSeconds(50);
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.allow("p1").allowed()).isTrue();
        }
        clock.advanceSeconds(11);

        assertThat(limiter.allow("p1").allowed()).isFalse();
    }

    @Test
    void deniedCalls_shouldNotConsumeQuota() {
        for (int i = 0; i < 5; i++) {
            limiter.allow("p1");
        }
        for (int i = 0; i < 20; i++) {
            assertThat(limiter.allow("p1").allowed()).isFalse();
        }
        clock.advanceSeconds(60);

        assertThat(limiter.allow("p1").remaining()).isEqualTo(4);
    }

    @Test
    void principals_shouldHaveIndependentWindows() {
        for (int i = 0; i < 5; i++) {
            limiter.allow("p1");
        }

        assertThat(limiter.allow("p1").allowed()).isFalse();
        assertThat(limiter.allow("p2").allowed()).isTrue();
    }

    @Test
    void evictIdle_shouldRemoveOnlyWindowsIdleLongerThanWindow() {
        limiter.allow("idle");
        clock.advanceSeconds(30);
        limiter.allow("active");
        clock.advance(Duration.ofMillis(30_001));

        int removed = limiter.evictIdle(() -> false);

        assertThat(removed).isEqualTo(1);
        assertThat(limiter.windowCount()).isEqualTo(1);
        // a fresh window is created transparently
        assertThat(limiter.allow("idle").remaining()).isEqualTo(4);
        assertThat(limiter.windowCount()).isEqualTo(2);
    }

    @Test
    void evictIdle_shouldStopWhenSignalled() {
        limiter.allow("a");
        limiter.allow("b");
        clock.advanceSeconds(120);

        assertThat(limiter.evictIdle(() -> true)).isZero();
        assertThat(limiter.windowCount()).isEqualTo(2);
    }

    @Test
    void allow_shouldFailOutsideReadyState() {
        SlidingWindowRateLimiter fresh = new SlidingWindowRateLimiter(1, Duration.ofSeconds(1), clock);
        assertThatThrownBy(() -> fresh.allow("p"))
                .isInstanceOfSatisfying(ComponentStateException.class,
                        e -> assertThat(e.getReason()).isEqualTo(ComponentStateException.Reason.NOT_INITIALIZED));

        fresh.start();
        fresh.close();
        assertThatThrownBy(() -> fresh.allow("p"))
                .isInstanceOfSatisfying(ComponentStateException.class,
                        e -> assertThat(e.getReason()).isEqualTo(ComponentStateException.Reason.CLOSED));
        assertThatThrownBy(fresh::start).isInstanceOf(ComponentStateException.class);
    }

    @Test
    void constructor_shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(1, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
