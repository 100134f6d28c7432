package com.bko.stravacache.harvest.web.dto;

import com.bko.stravacache.cache.CacheStats;
import com.bko.stravacache.cache.ResourceType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record CacheStatsDto(
        int totalEntries,
        Map<String, Integer> byResourceType,
        Instant oldestEntry,
        Instant newestEntry,
        int athleteCount,
        long totalBytes,
        String cacheSize
) {
    public static CacheStatsDto from(CacheStats stats) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (Map.Entry<ResourceType, Integer> entry : stats.perResourceTypeCounts().entrySet()) {
            byType.put(entry.getKey().label(), entry.getValue());
        }
        return new CacheStatsDto(stats.totalEntries(), byType, stats.oldestEntryAt(), stats.newestEntryAt(),
                stats.athleteCount(), stats.totalBytes(), stats.cacheSize());
    }
}
