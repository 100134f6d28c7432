package com.bko.stravacache.shared;

import java.time.Duration;

/**
 * Upstream quota configuration. Strava publishes 100 requests per 15 minutes and 1000 per day
 * for a default application.
 */
public record RateLimitSettings(
        int shortWindowLimit,
        Duration shortWindow,
        int longWindowLimit,
        Duration longWindow,
        double safetyRatio,
        boolean countFailedRequests
) {
    public static RateLimitSettings defaults() {
        return new RateLimitSettings(100, Duration.ofMinutes(15), 1000, Duration.ofDays(1), 0.9, true);
    }
}
