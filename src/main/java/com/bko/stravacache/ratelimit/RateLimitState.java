package com.bko.stravacache.ratelimit;

import java.time.Instant;

public record RateLimitState(
        int shortWindowCount,
        Instant shortWindowResetAt,
        int longWindowCount,
        Instant longWindowResetAt,
        int shortWindowLimit,
        int longWindowLimit
) {
    public int shortWindowRemaining() {
        return Math.max(0, shortWindowLimit - shortWindowCount);
    }

    public int longWindowRemaining() {
        return Math.max(0, longWindowLimit - longWindowCount);
    }
}
