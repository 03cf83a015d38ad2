package com.github.dimitryivaniuta.metergateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "meter-gateway")
public class GatewayProperties {

    public enum Mode { DEVELOPMENT, PRODUCTION }

    private Mode mode = Mode.DEVELOPMENT;

    private Security security = new Security();
    private RateLimit rateLimit = new RateLimit();
    private Cache cache = new Cache();
    private Maintenance maintenance = new Maintenance();

    public boolean isProduction() {
        return mode == Mode.PRODUCTION;
    }

    @Getter
    @Setter
    public static class Security {
        /** Secret material for the session-token key; hashed with SHA-256. */
        private String secretKey;
        private Duration sessionTtl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int limit = 100;
        private Duration window = Duration.ofHours(1);

        // authenticated and throttled; everything else is public
        private List<String> protectedPaths = List.of(
                "/api/**",
                "/auth/verify",
                "/auth/refresh",
                "/auth/logout"
        );
    }

    @Getter
    @Setter
    public static class Cache {
        private FastTier fastTier = new FastTier();
        private PersistentTier persistentTier = new PersistentTier();
    }

    @Getter
    @Setter
    public static class FastTier {
        private int capacity = 1000;
        private Duration ttl = Duration.ofMinutes(15);
    }

    @Getter
    @Setter
    public static class PersistentTier {
        private Duration ttl = Duration.ofHours(1);
        private long maxEntries = 100_000;
        private Duration timeout = Duration.ofMillis(500);
        private Duration maintenanceTimeout = Duration.ofSeconds(30);
        private int ioThreads = 4;
        private CircuitBreaker circuitBreaker = new CircuitBreaker();
    }

    @Getter
    @Setter
    public static class CircuitBreaker {
        private float failureRateThreshold = 50f;
        private int slidingWindowSize = 20;
        private int minimumNumberOfCalls = 10;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        private int permittedCallsInHalfOpenState = 3;
    }

    @Getter
    @Setter
    public static class Maintenance {
        private boolean enabled = true;
        private Duration sweepInterval = Duration.ofHours(1);
        private Duration statsInterval = Duration.ofMinutes(15);
        private int batchSize = 500;
    }
}
