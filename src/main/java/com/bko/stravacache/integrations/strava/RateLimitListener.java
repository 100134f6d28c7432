package com.bko.stravacache.integrations.strava;

public interface RateLimitListener {
    void onUpstreamRateLimit(UpstreamRateLimit rateLimit);
}
