package com.bko.stravacache.cache;

import java.time.Instant;
import java.util.Map;

public record CacheStats(
        int totalEntries,
        Map<ResourceType, Integer> perResourceTypeCounts,
        Instant oldestEntryAt,
        Instant newestEntryAt,
        int athleteCount,
        long totalBytes,
        String cacheSize
) {
}
