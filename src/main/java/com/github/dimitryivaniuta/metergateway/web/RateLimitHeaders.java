package com.github.dimitryivaniuta.metergateway.web;

import com.github.dimitryivaniuta.metergateway.gateway.ratelimit.RateLimitDecision;
import org.springframework.http.HttpHeaders;

import java.util.function.BiConsumer;

final class RateLimitHeaders {

    private RateLimitHeaders() {}

    static void apply(RateLimitDecision decision, BiConsumer<String, String> setter) {
        setter.accept(RequestContextKeys.RATE_LIMIT_LIMIT_HEADER, String.valueOf(decision.limit()));
        setter.accept(RequestContextKeys.RATE_LIMIT_REMAINING_HEADER, String.valueOf(decision.remaining()));
        // epoch seconds, rounded up
        long resetEpochSeconds = Math.floorDiv(decision.resetAt().toEpochMilli() + 999, 1000);
        setter.accept(RequestContextKeys.RATE_LIMIT_RESET_HEADER, String.valueOf(resetEpochSeconds));
    }

    static HttpHeaders of(RateLimitDecision decision) {
        HttpHeaders headers = new HttpHeaders();
        apply(decision, headers::set);
        return headers;
    }
}
