package com.bko.stravacache.harvest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Reads served purely from the cache. None of these call Strava.
 */
public interface CachedActivitiesUseCase {
    /**
     * Cached activity details of one athlete as Strava returned them, in ascending id order.
     */
    List<JsonNode> listCachedActivities(String athleteId);

    /**
     * Bundles for the ids whose activity detail is cached, assembled from whatever resources are cached.
     */
    Enrichment enrichFromCache(List<String> activityIds, String athleteId);

    CacheStatus getCacheStatus(String athleteId, String activityId);

    record Enrichment(Map<String, ActivityBundle> bundles, List<String> uncached) {
    }
}
