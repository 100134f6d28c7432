package com.bko.stravacache.harvest;

import com.bko.stravacache.ratelimit.RateLimitState;

import java.util.Map;

/**
 * @param results  bundles for every id served from cache or fetched, in input order. Ids whose fresh data
 *                 could not be persisted are included too.
 * @param failures failure message per failed id
 */
public record BatchResult(
        BatchStatus status,
        BatchCounters counters,
        Map<String, ActivityBundle> results,
        Map<String, String> failures,
        StopReason stopReason,
        RateLimitState rateLimit
) {
    public boolean hasFailures() {
        return counters.failed() > 0;
    }
}
