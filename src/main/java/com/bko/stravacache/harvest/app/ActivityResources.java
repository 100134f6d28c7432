package com.bko.stravacache.harvest.app;

import com.bko.stravacache.cache.CacheEntry;
import com.bko.stravacache.cache.CacheStore;
import com.bko.stravacache.cache.ResourceType;
import com.bko.stravacache.integrations.strava.StravaClientPort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each per-activity resource type to its upstream call. Every resource is cached as the raw response.
 */
@Component
class ActivityResources {
    static final TypeReference<JsonNode> PAYLOAD_TYPE = new TypeReference<>() {};

    private final StravaClientPort stravaClient;
    private final CacheStore cacheStore;

    ActivityResources(StravaClientPort stravaClient, CacheStore cacheStore) {
        this.stravaClient = stravaClient;
        this.cacheStore = cacheStore;
    }

    JsonNode fetch(ResourceType type, String accessToken, String activityId) throws IOException {
        return switch (type) {
            case ACTIVITY -> stravaClient.fetchActivityDetail(accessToken, activityId);
            case LAPS -> stravaClient.fetchLaps(accessToken, activityId);
            case COMMENTS -> stravaClient.fetchComments(accessToken, activityId);
            case PHOTOS -> stravaClient.fetchPhotos(accessToken, activityId);
            case STREAMS -> stravaClient.fetchStreams(accessToken, activityId);
            case ACTIVITY_LIST -> throw new IllegalArgumentException("Activity lists are not a per-activity resource");
        };
    }

    BundleParts loadCached(String athleteId, String activityId, Set<ResourceType> types) {
        BundleParts parts = new BundleParts(athleteId, activityId);
        for (ResourceType type : types) {
            lookup(athleteId, activityId, type)
                    .ifPresent(entry -> parts.put(type, entry.payload(), entry.fetchedAt()));
        }
        return parts;
    }

    Optional<CacheEntry<JsonNode>> lookup(String athleteId, String activityId, ResourceType type) {
        if (type == ResourceType.ACTIVITY_LIST) {
            throw new IllegalArgumentException("Activity lists are not a per-activity resource");
        }
        return cacheStore.get(athleteId, type, activityId, PAYLOAD_TYPE);
    }
}
