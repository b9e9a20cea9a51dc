package com.openrangelabs.blacklist.collector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Externalized settings for the collection engine.
 */
@Component
@ConfigurationProperties(prefix = "collector")
@Data
public class CollectorProperties {

    private Scheduling scheduling = new Scheduling();
    private Defaults defaults = new Defaults();
    private Map<String, RateLimit> rateLimits = new HashMap<>();
    private RateLimit defaultRateLimit = new RateLimit();
    private Credentials credentials = new Credentials();
    private Regtech regtech = new Regtech();

    /**
     * Rate limit settings for a source, falling back to the default bucket.
     */
    public RateLimit rateLimitFor(String sourceName) {
        RateLimit configured = rateLimits.get(sourceName.toUpperCase(Locale.ROOT));
        return configured != null ? configured : defaultRateLimit;
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(30);
        private boolean runOnStartup = true;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Defaults {
        private Duration interval = Duration.ofDays(1);
        private Duration maxBackoff = Duration.ofHours(1);
        private int scheduledWindowDays = 1;
        private int backfillWindowDays = 90;
        private int maxWindowDays = 366;
    }

    @Data
    public static class RateLimit {
        private int capacity = 5;
        private double refillPerSecond = 2.0;
        private Duration acquireTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Credentials {
        private Duration cacheTtl = Duration.ofSeconds(60);
    }

    @Data
    public static class Regtech {
        private String baseUrl = "https://regtech.fsec.or.kr";
        private Duration requestTimeout = Duration.ofSeconds(30);
        private int emptyExportThresholdBytes = 1000;
        private int sessionExchangeRetries = 1;
    }
}
