package com.bko.stravacache.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class SettingsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SettingsConfiguration.class);
    private static final String DEFAULT_CACHE_DIR = ".cache/strava";

    @Bean
    public AppSettings appSettings(EnvConfig envConfig) {
        StravaSettings strava = new StravaSettings(
                textOrDefault(envConfig.get("strava.api_base"), StravaSettings.DEFAULT_API_BASE)
        );
        CacheSettings cache = new CacheSettings(
                Path.of(textOrDefault(envConfig.get("cache.dir"), DEFAULT_CACHE_DIR))
        );
        RateLimitSettings defaults = RateLimitSettings.defaults();
        RateLimitSettings rateLimit = new RateLimitSettings(
                intOrDefault(envConfig, "rate_limit.short_limit", defaults.shortWindowLimit()),
                Duration.ofMinutes(intOrDefault(envConfig, "rate_limit.short_window_minutes", 15)),
                intOrDefault(envConfig, "rate_limit.long_limit", defaults.longWindowLimit()),
                Duration.ofHours(intOrDefault(envConfig, "rate_limit.long_window_hours", 24)),
                ratioOrDefault(envConfig, "rate_limit.safety_ratio", defaults.safetyRatio()),
                boolOrDefault(envConfig, "rate_limit.count_failed_requests", defaults.countFailedRequests())
        );
        BatchSettings batchDefaults = BatchSettings.defaults();
        BatchSettings batch = new BatchSettings(
                intOrDefault(envConfig, "batch.max_concurrent", batchDefaults.defaultMaxConcurrent()),
                Duration.ofSeconds(intOrDefault(envConfig, "batch.job_timeout_seconds",
                        (int) batchDefaults.jobTimeout().getSeconds()))
        );
        return new AppSettings(strava, cache, rateLimit, batch);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private String textOrDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private int intOrDefault(EnvConfig envConfig, String key, int fallback) {
        String raw = envConfig.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(raw);
            if (parsed > 0) {
                return parsed;
            }
            logger.warn("Ignoring non-positive value '{}' for {}, using {}", raw, key, fallback);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed value '{}' for {}, using {}", raw, key, fallback);
        }
        return fallback;
    }

    private double ratioOrDefault(EnvConfig envConfig, String key, double fallback) {
        String raw = envConfig.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double parsed = Double.parseDouble(raw);
            if (parsed > 0 && parsed <= 1) {
                return parsed;
            }
            logger.warn("Ignoring out-of-range ratio '{}' for {}, using {}", raw, key, fallback);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed value '{}' for {}, using {}", raw, key, fallback);
        }
        return fallback;
    }

    private boolean boolOrDefault(EnvConfig envConfig, String key, boolean fallback) {
        String raw = envConfig.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Boolean.parseBoolean(raw);
    }
}
