package com.github.dimitryivaniuta.metergateway.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record TokenVerifyResponse(
        boolean valid,
        @JsonProperty("principal_id") String principalId,
        @JsonProperty("expires_at") Instant expiresAt
) {}
