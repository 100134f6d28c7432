package com.bko.stravacache.harvest.app;

import com.bko.stravacache.cache.CacheEntry;
import com.bko.stravacache.cache.CacheKeys;
import com.bko.stravacache.cache.CacheStore;
import com.bko.stravacache.cache.ResourceType;
import com.bko.stravacache.harvest.BatchFetchUseCase;
import com.bko.stravacache.harvest.BatchOptions;
import com.bko.stravacache.harvest.BatchResult;
import com.bko.stravacache.harvest.StopReason;
import com.bko.stravacache.ratelimit.RateLimitCheck;
import com.bko.stravacache.ratelimit.RateLimitTracker;
import com.bko.stravacache.shared.AppSettings;
import com.bko.stravacache.shared.BatchSettings;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves a list of activity ids to bundles: cache first, then Strava through a bounded worker pool.
 * <p>
 * Quota is reserved per id at dispatch time. Once the tracker refuses a reservation, or the job deadline
 * passes, nothing more is scheduled and every id not yet dispatched is counted as skipped. A worker checks
 * the deadline again before each upstream call; an id it cannot finish in time is skipped too, and its
 * unused reservations are returned. A call already started is never abandoned.
 */
@Service
public class BatchOrchestrator implements BatchFetchUseCase {
    private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ActivityResources resources;
    private final CacheStore cacheStore;
    private final RateLimitTracker rateLimitTracker;
    private final BatchSettings batchSettings;
    private final Clock clock;

    public BatchOrchestrator(ActivityResources resources, CacheStore cacheStore, RateLimitTracker rateLimitTracker,
                             AppSettings settings, Clock clock) {
        this.resources = resources;
        this.cacheStore = cacheStore;
        this.rateLimitTracker = rateLimitTracker;
        this.batchSettings = settings.batch();
        this.clock = clock;
    }

    @Override
    public BatchResult batchFetch(String accessToken, List<String> activityIds, String athleteId, BatchOptions options) {
        BatchOptions opts = options == null ? BatchOptions.defaults() : options;
        requireText(accessToken, "accessToken");
        requireText(athleteId, "athleteId");
        CacheKeys.require(athleteId, "athleteId");
        List<String> ids = distinctIds(activityIds);
        int maxConcurrent = opts.maxConcurrent() == null ? batchSettings.defaultMaxConcurrent() : opts.maxConcurrent();
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        Duration timeout = opts.timeout() == null ? batchSettings.jobTimeout() : opts.timeout();
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        Set<ResourceType> wanted = opts.resources();
        if (wanted.isEmpty() || wanted.contains(ResourceType.ACTIVITY_LIST)) {
            throw new IllegalArgumentException("resources must be a non-empty set of per-activity resources: " + wanted);
        }

        Instant deadline = clock.instant().plus(timeout);
        BatchJob job = new BatchJob(ids, opts.onProgress(), rateLimitTracker);
        logger.info("Batch of {} activities for athlete {} (maxConcurrent={}, forceRefresh={}, resources={})",
                ids.size(), athleteId, maxConcurrent, opts.forceRefresh(), wanted);
        job.start();

        List<BundleParts> misses = new ArrayList<>();
        for (String id : ids) {
            BundleParts parts = opts.forceRefresh()
                    ? new BundleParts(athleteId, id)
                    : resources.loadCached(athleteId, id, wanted);
            if (parts.missing(wanted).isEmpty()) {
                job.servedFromCache(id, parts.toBundle());
            } else {
                misses.add(parts);
            }
        }

        StopReason stopReason = misses.isEmpty()
                ? StopReason.NONE
                : dispatch(job, misses, accessToken, athleteId, wanted, maxConcurrent, deadline);

        BatchResult result = job.toResult(stopReason);
        logger.info("Batch finished: {} from cache, {} fetched, {} failed, {} skipped (stop reason: {})",
                result.counters().fromCache(), result.counters().fetched(), result.counters().failed(),
                result.counters().skippedRateLimit(), stopReason.label());
        return result;
    }

    private StopReason dispatch(BatchJob job, List<BundleParts> misses, String accessToken, String athleteId,
                                Set<ResourceType> wanted, int maxConcurrent, Instant deadline) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxConcurrent, misses.size()), workerThreads());
        Semaphore slots = new Semaphore(maxConcurrent);
        StopReason stopReason = StopReason.NONE;
        int next = 0;
        try {
            while (next < misses.size()) {
                BundleParts parts = misses.get(next);
                Duration left = Duration.between(clock.instant(), deadline);
                if (left.isNegative() || left.isZero()) {
                    stopReason = StopReason.DEADLINE;
                    break;
                }
                if (!slots.tryAcquire(left.toMillis(), TimeUnit.MILLISECONDS)) {
                    stopReason = StopReason.DEADLINE;
                    break;
                }
                Set<ResourceType> missing = parts.missing(wanted);
                if (!rateLimitTracker.tryReserve(missing.size())) {
                    slots.release();
                    stopReason = StopReason.RATE_LIMIT;
                    break;
                }
                pool.execute(() -> {
                    try {
                        fetchMissing(job, parts, missing, accessToken, athleteId, deadline);
                    } finally {
                        slots.release();
                    }
                });
                next++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopReason = StopReason.INTERRUPTED;
        } finally {
            pool.shutdown();
        }

        if (stopReason != StopReason.NONE) {
            String reason = stopReasonText(stopReason);
            logger.warn("Stopped scheduling after {} of {} live fetches: {}", next, misses.size(), reason);
            job.stopped(reason);
            for (int i = next; i < misses.size(); i++) {
                job.skipped(misses.get(i).activityId());
            }
        }
        awaitInFlight(pool);
        if (stopReason == StopReason.NONE && job.cutByDeadline()) {
            stopReason = StopReason.DEADLINE;
        }
        return stopReason;
    }

    private void fetchMissing(BatchJob job, BundleParts parts, Set<ResourceType> missing, String accessToken,
                              String athleteId, Instant deadline) {
        String activityId = parts.activityId();
        List<String> fetchErrors = new ArrayList<>();
        List<String> storeErrors = new ArrayList<>();
        int unsettled = missing.size();
        boolean cutShort = false;
        for (ResourceType type : missing) {
            if (!clock.instant().isBefore(deadline)) {
                rateLimitTracker.releaseReserved(unsettled);
                cutShort = true;
                break;
            }
            unsettled--;
            JsonNode payload;
            try {
                payload = resources.fetch(type, accessToken, activityId);
                rateLimitTracker.completeReserved(true);
            } catch (IOException | RuntimeException e) {
                rateLimitTracker.completeReserved(false);
                logger.warn("Could not fetch {} of activity {}: {}", type.label(), activityId, e.getMessage());
                fetchErrors.add(type.label() + ": " + e.getMessage());
                continue;
            }
            Instant fetchedAt = clock.instant();
            parts.put(type, payload, fetchedAt);
            try {
                cacheStore.put(new CacheEntry<>(athleteId, activityId, type, payload, fetchedAt));
            } catch (IOException | RuntimeException e) {
                logger.warn("Could not cache {} of activity {}: {}", type.label(), activityId, e.getMessage());
                storeErrors.add("storing " + type.label() + ": " + e.getMessage());
            }
        }

        if (!fetchErrors.isEmpty()) {
            job.failed(activityId, String.join("; ", fetchErrors), null);
        } else if (cutShort) {
            logger.warn("Job deadline passed while fetching activity {}, {} resources left unrequested", activityId, unsettled);
            job.skippedAtDeadline(activityId);
        } else if (!storeErrors.isEmpty()) {
            job.failed(activityId, String.join("; ", storeErrors), parts.toBundle());
        } else {
            job.fetched(activityId, parts.toBundle());
        }
    }

    private String stopReasonText(StopReason stopReason) {
        return switch (stopReason) {
            case RATE_LIMIT -> {
                RateLimitCheck check = rateLimitTracker.isNearLimit();
                yield check.canMakeRequest()
                        ? "Not enough rate limit headroom left for the remaining activities"
                        : check.reason();
            }
            case DEADLINE -> "Job deadline passed before all activities were scheduled";
            case INTERRUPTED -> "Batch interrupted";
            case NONE -> "";
        };
    }

    private static void awaitInFlight(ExecutorService pool) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static List<String> distinctIds(List<String> activityIds) {
        if (activityIds == null || activityIds.isEmpty()) {
            throw new IllegalArgumentException("activityIds must not be empty");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String id : activityIds) {
            requireText(id, "activityId");
            distinct.add(CacheKeys.require(id.trim(), "activityId"));
        }
        return List.copyOf(distinct);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static ThreadFactory workerThreads() {
        int poolId = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadId = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "strava-batch-" + poolId + "-" + threadId.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
