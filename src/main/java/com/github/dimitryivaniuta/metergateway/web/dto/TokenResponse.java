package com.github.dimitryivaniuta.metergateway.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.dimitryivaniuta.metergateway.gateway.auth.SessionToken;

import java.time.Duration;
import java.time.Instant;

public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("expires_at") Instant expiresAt
) {

    public static TokenResponse from(SessionToken token) {
        long seconds = Duration.between(token.issuedAt(), token.expiresAt()).getSeconds();
        return new TokenResponse(token.value(), "bearer", seconds, token.expiresAt());
    }
}
