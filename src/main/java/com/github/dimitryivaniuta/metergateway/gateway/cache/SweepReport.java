package com.github.dimitryivaniuta.metergateway.gateway.cache;

public record SweepReport(long fastTierExpired, long persistentTierExpired, long persistentTierCulled, boolean interrupted) {

    public long total() {
        return fastTierExpired + persistentTierExpired + persistentTierCulled;
    }
}
