package com.bko.stravacache.shared;

public record AppSettings(StravaSettings strava, CacheSettings cache, RateLimitSettings rateLimit, BatchSettings batch) {
}
