package com.bko.stravacache.harvest;

import com.bko.stravacache.ratelimit.RateLimitState;

/**
 * @param activityId the id whose resolution triggered this event, {@code null} for job-level events
 * @param detail     human readable note, e.g. why scheduling stopped
 */
public record BatchProgress(BatchPhase phase, BatchCounters counters, String activityId, RateLimitState rateLimit, String detail) {
}
