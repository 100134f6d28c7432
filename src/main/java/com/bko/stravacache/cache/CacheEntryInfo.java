package com.bko.stravacache.cache;

import java.time.Instant;

public record CacheEntryInfo(String athleteId, String resourceId, ResourceType resourceType, Instant fetchedAt, long sizeBytes) {
}
