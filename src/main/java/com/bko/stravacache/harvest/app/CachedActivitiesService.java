package com.bko.stravacache.harvest.app;

import com.bko.stravacache.cache.CacheEntry;
import com.bko.stravacache.cache.CacheStore;
import com.bko.stravacache.cache.ResourceType;
import com.bko.stravacache.harvest.ActivityBundle;
import com.bko.stravacache.harvest.BatchOptions;
import com.bko.stravacache.harvest.CacheStatus;
import com.bko.stravacache.harvest.CachedActivitiesUseCase;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class CachedActivitiesService implements CachedActivitiesUseCase {
    private static final Set<ResourceType> ALL_RESOURCES = EnumSet.of(
            ResourceType.ACTIVITY, ResourceType.LAPS, ResourceType.COMMENTS, ResourceType.PHOTOS, ResourceType.STREAMS);

    private final CacheStore cacheStore;
    private final ActivityResources resources;

    public CachedActivitiesService(CacheStore cacheStore, ActivityResources resources) {
        this.cacheStore = cacheStore;
        this.resources = resources;
    }

    @Override
    public List<JsonNode> listCachedActivities(String athleteId) {
        List<JsonNode> activities = new ArrayList<>();
        for (String id : cacheStore.listIds(ResourceType.ACTIVITY, athleteId)) {
            cacheStore.get(athleteId, ResourceType.ACTIVITY, id, ActivityResources.PAYLOAD_TYPE)
                    .map(CacheEntry::payload)
                    .ifPresent(activities::add);
        }
        return activities;
    }

    @Override
    public Enrichment enrichFromCache(List<String> activityIds, String athleteId) {
        Map<String, ActivityBundle> bundles = new LinkedHashMap<>();
        List<String> uncached = new ArrayList<>();
        for (String id : activityIds) {
            BundleParts parts = resources.loadCached(athleteId, id, BatchOptions.BUNDLE_RESOURCES);
            if (parts.contains(ResourceType.ACTIVITY)) {
                bundles.put(id, parts.toBundle());
            } else {
                uncached.add(id);
            }
        }
        return new Enrichment(bundles, uncached);
    }

    @Override
    public CacheStatus getCacheStatus(String athleteId, String activityId) {
        BundleParts parts = resources.loadCached(athleteId, activityId, ALL_RESOURCES);
        if (parts.isEmpty()) {
            return new CacheStatus(activityId, false, Map.of(), 0, 0, 0, null);
        }
        ActivityBundle bundle = parts.toBundle();
        Map<ResourceType, Instant> cachedAt = new EnumMap<>(parts.fetchedAt());
        return new CacheStatus(
                activityId,
                parts.contains(ResourceType.ACTIVITY),
                cachedAt,
                bundle.laps().size(),
                bundle.comments().size(),
                bundle.photos().size(),
                latest(cachedAt.values())
        );
    }

    private static Instant latest(Collection<Instant> instants) {
        Instant latest = null;
        for (Instant instant : instants) {
            if (latest == null || instant.isAfter(latest)) {
                latest = instant;
            }
        }
        return latest;
    }
}
