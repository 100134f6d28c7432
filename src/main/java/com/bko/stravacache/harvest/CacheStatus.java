package com.bko.stravacache.harvest;

import com.bko.stravacache.cache.ResourceType;

import java.time.Instant;
import java.util.Map;

public record CacheStatus(
        String activityId,
        boolean exists,
        Map<ResourceType, Instant> cachedResources,
        int lapCount,
        int commentCount,
        int photoCount,
        Instant lastUpdated
) {
}
