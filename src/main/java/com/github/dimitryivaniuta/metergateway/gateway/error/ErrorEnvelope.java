package com.github.dimitryivaniuta.metergateway.gateway.error;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Body returned for every gateway-originated rejection.
 */
public record ErrorEnvelope(
        String detail,
        @JsonProperty("error_code") ErrorCode errorCode,
        Instant timestamp
) {}
