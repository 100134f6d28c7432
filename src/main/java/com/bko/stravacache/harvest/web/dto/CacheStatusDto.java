package com.bko.stravacache.harvest.web.dto;

import com.bko.stravacache.cache.ResourceType;
import com.bko.stravacache.harvest.CacheStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record CacheStatusDto(
        String activityId,
        boolean exists,
        Map<String, Instant> cachedResources,
        int lapCount,
        int commentCount,
        int photoCount,
        Instant lastUpdated
) {
    public static CacheStatusDto from(CacheStatus status) {
        Map<String, Instant> resources = new LinkedHashMap<>();
        for (Map.Entry<ResourceType, Instant> entry : status.cachedResources().entrySet()) {
            resources.put(entry.getKey().label(), entry.getValue());
        }
        return new CacheStatusDto(status.activityId(), status.exists(), resources, status.lapCount(),
                status.commentCount(), status.photoCount(), status.lastUpdated());
    }
}
