package com.bko.stravacache.harvest;

import com.bko.stravacache.ratelimit.RateLimitState;

public class QuotaExhaustedException extends RuntimeException {
    private final RateLimitState rateLimit;

    public QuotaExhaustedException(String message, RateLimitState rateLimit) {
        super(message);
        this.rateLimit = rateLimit;
    }

    public RateLimitState getRateLimit() {
        return rateLimit;
    }
}
