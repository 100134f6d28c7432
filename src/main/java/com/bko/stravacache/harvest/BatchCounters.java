package com.bko.stravacache.harvest;

/**
 * At job completion {@code fromCache + fetched + failed + skippedRateLimit == total}.
 */
public record BatchCounters(int total, int fromCache, int fetched, int failed, int skippedRateLimit, int remaining) {
    public int resolved() {
        return fromCache + fetched + failed + skippedRateLimit;
    }
}
