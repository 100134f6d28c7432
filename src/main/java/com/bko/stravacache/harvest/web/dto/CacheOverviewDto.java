package com.bko.stravacache.harvest.web.dto;

import java.util.List;

public record CacheOverviewDto(
        CacheStatsDto stats,
        List<String> cachedActivityIds,
        int totalCached,
        RateLimitDto rateLimits
) { }
