package com.github.dimitryivaniuta.metergateway.gateway.ratelimit;

import com.github.dimitryivaniuta.metergateway.gateway.error.ErrorCode;
import com.github.dimitryivaniuta.metergateway.gateway.error.GatewayException;
import lombok.Getter;

@Getter
public class RateLimitExceededException extends GatewayException {

    private final RateLimitDecision decision;
    private final long retryAfterSeconds;

    public RateLimitExceededException(RateLimitDecision decision, long retryAfterSeconds) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED, "Rate limit exceeded. Try again in " + retryAfterSeconds + " seconds.");
        this.decision = decision;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
