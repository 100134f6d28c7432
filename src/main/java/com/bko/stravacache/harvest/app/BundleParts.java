package com.bko.stravacache.harvest.app;

import com.bko.stravacache.cache.ResourceType;
import com.bko.stravacache.harvest.ActivityBundle;
import com.bko.stravacache.integrations.strava.StravaJson;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The resources collected so far for one activity, each with the time it was fetched from Strava.
 */
final class BundleParts {
    private final String athleteId;
    private final String activityId;
    private final Map<ResourceType, JsonNode> payloads = new EnumMap<>(ResourceType.class);
    private final Map<ResourceType, Instant> fetchedAt = new EnumMap<>(ResourceType.class);

    BundleParts(String athleteId, String activityId) {
        this.athleteId = athleteId;
        this.activityId = activityId;
    }

    String activityId() {
        return activityId;
    }

    void put(ResourceType type, JsonNode payload, Instant at) {
        payloads.put(type, payload);
        fetchedAt.put(type, at);
    }

    boolean contains(ResourceType type) {
        return fetchedAt.containsKey(type);
    }

    boolean isEmpty() {
        return fetchedAt.isEmpty();
    }

    Set<ResourceType> missing(Set<ResourceType> wanted) {
        EnumSet<ResourceType> missing = EnumSet.noneOf(ResourceType.class);
        for (ResourceType type : wanted) {
            if (!contains(type)) {
                missing.add(type);
            }
        }
        return missing;
    }

    Map<ResourceType, Instant> fetchedAt() {
        return fetchedAt;
    }

    ActivityBundle toBundle() {
        Instant oldest = null;
        for (Instant at : fetchedAt.values()) {
            if (oldest == null || at.isBefore(oldest)) {
                oldest = at;
            }
        }
        return new ActivityBundle(
                activityId,
                athleteId,
                payloads.get(ResourceType.ACTIVITY),
                payloadOr(ResourceType.LAPS, StravaJson.emptyArray()),
                payloadOr(ResourceType.COMMENTS, StravaJson.emptyArray()),
                payloadOr(ResourceType.PHOTOS, StravaJson.emptyArray()),
                payloadOr(ResourceType.STREAMS, StravaJson.emptyObject()),
                oldest
        );
    }

    private JsonNode payloadOr(ResourceType type, JsonNode empty) {
        JsonNode payload = payloads.get(type);
        return payload == null || payload.isNull() ? empty : payload;
    }
}
