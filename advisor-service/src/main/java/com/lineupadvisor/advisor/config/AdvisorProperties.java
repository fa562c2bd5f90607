package com.lineupadvisor.advisor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code advisor.*} settings from application.yml.
 */
@Data
@ConfigurationProperties(prefix = "advisor")
public class AdvisorProperties {

    /** NFL season the bye-week table and requests default to. */
    private int season = 2025;

    private Tables tables = new Tables();

    private Fetch fetch = new Fetch();

    private Cache cache = new Cache();

    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Tables {
        private String strategyProfiles = "classpath:tables/strategy-profiles.json";
        private String positionBaselines = "classpath:tables/position-baselines.json";
        private String byeWeeks = "classpath:tables/bye-weeks-2025.json";
    }

    @Data
    public static class Fetch {
        /** Upper bound for one provider call; slower providers are dropped for the request. */
        private Duration timeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Cache {
        private Duration defaultTtl = Duration.ofHours(1);

        /** Provider name → TTL, e.g. trending 30m, projections 1h. */
        private Map<String, Duration> ttl = new LinkedHashMap<>();

        private int maxEntries = 10_000;

        public Duration ttlFor(String provider) {
            return ttl.getOrDefault(provider, defaultTtl);
        }
    }

    @Data
    public static class RateLimit {
        private int maxRequests = 900;
        private Duration window = Duration.ofHours(1);
    }
}
