package com.bko.stravacache.harvest;

import com.bko.stravacache.ratelimit.RateLimitState;

public record HarvestSummary(
        HarvestStatus status,
        int activitiesFound,
        BatchCounters processed,
        DataCollected dataCollected,
        RateLimitState rateLimits,
        String message
) {
    public record DataCollected(int activities, int withLaps, int withComments, int totalLaps, int totalComments) {
        public static final DataCollected EMPTY = new DataCollected(0, 0, 0, 0, 0);
    }
}
