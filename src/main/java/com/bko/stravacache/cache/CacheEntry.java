package com.bko.stravacache.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * One cached upstream response. A later write for the same key replaces it whole.
 */
public record CacheEntry<T>(String athleteId, String resourceId, ResourceType resourceType, T payload, Instant fetchedAt) {
    public CacheEntry {
        Objects.requireNonNull(athleteId, "athleteId");
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
    }
}
