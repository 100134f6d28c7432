package com.bko.stravacache.harvest.web.dto;

import com.bko.stravacache.ratelimit.RateLimitCheck;
import com.bko.stravacache.ratelimit.RateLimitState;

import java.time.Instant;

public record RateLimitDto(
        int shortTermUsage,
        int shortTermLimit,
        int shortTermRemaining,
        Instant shortTermResetsAt,
        int dailyUsage,
        int dailyLimit,
        int dailyRemaining,
        Instant dailyResetsAt,
        boolean canMakeRequest,
        String reason
) {
    public static RateLimitDto from(RateLimitState state, RateLimitCheck check) {
        return new RateLimitDto(
                state.shortWindowCount(), state.shortWindowLimit(), state.shortWindowRemaining(), state.shortWindowResetAt(),
                state.longWindowCount(), state.longWindowLimit(), state.longWindowRemaining(), state.longWindowResetAt(),
                check.canMakeRequest(), check.reason());
    }
}
