package com.github.dimitryivaniuta.metergateway.gateway.ratelimit;

@FunctionalInterface
public interface AdmissionPolicy {

    RateLimitDecision allow(String principalId);
}
