package com.bko.stravacache.cache;

import java.time.Instant;

public record CachedAthlete(String athleteId, int activityCount, Instant lastCacheUpdate) {
}
