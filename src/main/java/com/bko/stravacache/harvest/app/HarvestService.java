package com.bko.stravacache.harvest.app;

import com.bko.stravacache.cache.CacheEntry;
import com.bko.stravacache.cache.CacheKeys;
import com.bko.stravacache.cache.CacheStore;
import com.bko.stravacache.cache.ResourceType;
import com.bko.stravacache.harvest.ActivityBundle;
import com.bko.stravacache.harvest.BatchFetchUseCase;
import com.bko.stravacache.harvest.BatchOptions;
import com.bko.stravacache.harvest.BatchResult;
import com.bko.stravacache.harvest.BatchStatus;
import com.bko.stravacache.harvest.HarvestRequest;
import com.bko.stravacache.harvest.HarvestStatus;
import com.bko.stravacache.harvest.HarvestSummary;
import com.bko.stravacache.harvest.HarvestSummary.DataCollected;
import com.bko.stravacache.harvest.HarvestUseCase;
import com.bko.stravacache.integrations.strava.StravaClientPort;
import com.bko.stravacache.integrations.strava.StravaJson;
import com.bko.stravacache.ratelimit.RateLimitCheck;
import com.bko.stravacache.ratelimit.RateLimitTracker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Caches the resources the PDF book needs for an athlete's activities in a period.
 * The activity list itself is stored as an {@link ResourceType#ACTIVITY_LIST} snapshot.
 */
@Service
public class HarvestService implements HarvestUseCase {
    private static final Logger logger = LoggerFactory.getLogger(HarvestService.class);
    static final int MAX_PAGE_SIZE = 100;
    static final int RECENT_MONTHS = 6;

    private final StravaClientPort stravaClient;
    private final CacheStore cacheStore;
    private final RateLimitTracker rateLimitTracker;
    private final BatchFetchUseCase batchFetch;
    private final Clock clock;

    public HarvestService(StravaClientPort stravaClient, CacheStore cacheStore, RateLimitTracker rateLimitTracker,
                          BatchFetchUseCase batchFetch, Clock clock) {
        this.stravaClient = stravaClient;
        this.cacheStore = cacheStore;
        this.rateLimitTracker = rateLimitTracker;
        this.batchFetch = batchFetch;
        this.clock = clock;
    }

    @Override
    public HarvestSummary harvest(String accessToken, String athleteId, HarvestRequest request) throws IOException {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken must not be blank");
        }
        if (athleteId == null || athleteId.isBlank()) {
            throw new IllegalArgumentException("athleteId must not be blank");
        }
        CacheKeys.require(athleteId, "athleteId");

        RateLimitCheck check = rateLimitTracker.isNearLimit();
        if (!check.canMakeRequest()) {
            logger.warn("Harvest for athlete {} refused: {}", athleteId, check.reason());
            return new HarvestSummary(HarvestStatus.RATE_LIMITED, 0, null, DataCollected.EMPTY,
                    rateLimitTracker.getInfo(), check.reason());
        }

        Instant after = null;
        Instant before = null;
        switch (request.mode()) {
            case RECENT -> after = clock.instant().atZone(ZoneOffset.UTC).minusMonths(RECENT_MONTHS).toInstant();
            case YEAR -> {
                after = LocalDate.of(request.year(), 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
                before = LocalDate.of(request.year() + 1, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            case FULL -> { }
        }

        logger.info("Harvesting up to {} activities for athlete {} (mode {})", request.limit(), athleteId, request.mode().label());
        List<JsonNode> activities = listActivities(accessToken, request.limit(), after, before);
        snapshotList(athleteId, activities, after, before);

        List<String> ids = new ArrayList<>();
        for (JsonNode activity : activities) {
            String id = StravaJson.activityId(activity);
            if (id != null) {
                ids.add(id);
            }
        }
        if (ids.isEmpty()) {
            return new HarvestSummary(HarvestStatus.COMPLETE, 0, null, DataCollected.EMPTY,
                    rateLimitTracker.getInfo(), "No activities found for the requested period");
        }

        BatchOptions options = BatchOptions.defaults()
                .withResources(BatchOptions.PDF_RESOURCES)
                .withProgressListener(progress -> logger.debug("Harvest progress: {} {}/{}", progress.phase().label(),
                        progress.counters().resolved(), progress.counters().total()));
        BatchResult result = batchFetch.batchFetch(accessToken, ids, athleteId, options);

        DataCollected collected = collected(result);
        HarvestStatus status = result.status() == BatchStatus.PARTIAL ? HarvestStatus.PARTIAL : HarvestStatus.COMPLETE;
        String message = status == HarvestStatus.PARTIAL
                ? "Stopped early: " + result.counters().skippedRateLimit() + " activities left for a later run"
                : "Cached " + collected.activities() + " of " + ids.size() + " activities";
        logger.info("Harvest for athlete {}: {}", athleteId, message);
        return new HarvestSummary(status, ids.size(), result.counters(), collected, result.rateLimit(), message);
    }

    private List<JsonNode> listActivities(String accessToken, int limit, Instant after, Instant before) throws IOException {
        List<JsonNode> activities = new ArrayList<>();
        int page = 1;
        while (activities.size() < limit) {
            int perPage = Math.min(MAX_PAGE_SIZE, limit - activities.size());
            if (!rateLimitTracker.tryReserve(1)) {
                logger.warn("Rate limit reached while listing activities, continuing with {}", activities.size());
                break;
            }
            JsonNode pageActivities;
            try {
                pageActivities = stravaClient.getAthleteActivities(accessToken, page, perPage, after, before);
                rateLimitTracker.completeReserved(true);
            } catch (IOException | RuntimeException e) {
                rateLimitTracker.completeReserved(false);
                throw e;
            }
            for (JsonNode activity : pageActivities) {
                activities.add(activity);
            }
            if (pageActivities.size() < perPage) {
                break;
            }
            page++;
        }
        return activities.size() > limit ? new ArrayList<>(activities.subList(0, limit)) : activities;
    }

    private void snapshotList(String athleteId, List<JsonNode> activities, Instant after, Instant before) {
        String key = listKey(after, before);
        ArrayNode snapshot = StravaJson.emptyArray().addAll(activities);
        try {
            cacheStore.put(new CacheEntry<>(athleteId, key, ResourceType.ACTIVITY_LIST, snapshot, clock.instant()));
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not cache activity list {} for athlete {}: {}", key, athleteId, e.getMessage());
        }
    }

    static String listKey(Instant after, Instant before) {
        List<String> parts = new ArrayList<>();
        if (after != null) {
            parts.add("after-" + after.getEpochSecond());
        }
        if (before != null) {
            parts.add("before-" + before.getEpochSecond());
        }
        return parts.isEmpty() ? "all" : String.join("_", parts);
    }

    private static DataCollected collected(BatchResult result) {
        int withLaps = 0;
        int withComments = 0;
        int totalLaps = 0;
        int totalComments = 0;
        for (ActivityBundle bundle : result.results().values()) {
            if (!bundle.laps().isEmpty()) {
                withLaps++;
                totalLaps += bundle.laps().size();
            }
            if (!bundle.comments().isEmpty()) {
                withComments++;
                totalComments += bundle.comments().size();
            }
        }
        return new DataCollected(result.results().size(), withLaps, withComments, totalLaps, totalComments);
    }
}
