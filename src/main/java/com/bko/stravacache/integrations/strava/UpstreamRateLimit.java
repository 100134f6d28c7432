package com.bko.stravacache.integrations.strava;

import java.util.Optional;

/**
 * Usage reported by Strava on each response, e.g. {@code X-RateLimit-Usage: 45,310} and
 * {@code X-RateLimit-Limit: 100,1000} (short window first, daily second).
 */
public record UpstreamRateLimit(int shortWindowUsage, int longWindowUsage, Integer shortWindowLimit, Integer longWindowLimit) {

    public static Optional<UpstreamRateLimit> parse(String usageHeader, String limitHeader) {
        int[] usage = parsePair(usageHeader);
        if (usage == null) {
            return Optional.empty();
        }
        int[] limit = parsePair(limitHeader);
        return Optional.of(new UpstreamRateLimit(
                usage[0],
                usage[1],
                limit != null && limit[0] > 0 ? limit[0] : null,
                limit != null && limit[1] > 0 ? limit[1] : null
        ));
    }

    private static int[] parsePair(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String[] parts = header.split(",");
        if (parts.length < 2) {
            return null;
        }
        try {
            return new int[]{Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())};
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
