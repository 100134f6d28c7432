package com.bko.stravacache.ratelimit;

public record RateLimitCheck(boolean canMakeRequest, String reason) {
    public static RateLimitCheck allowed() {
        return new RateLimitCheck(true, null);
    }

    public static RateLimitCheck refused(String reason) {
        return new RateLimitCheck(false, reason);
    }
}
