package com.bko.stravacache.harvest.app;

import com.bko.stravacache.harvest.ActivityBundle;
import com.bko.stravacache.harvest.BatchCounters;
import com.bko.stravacache.harvest.BatchPhase;
import com.bko.stravacache.harvest.BatchProgress;
import com.bko.stravacache.harvest.BatchResult;
import com.bko.stravacache.harvest.BatchStatus;
import com.bko.stravacache.harvest.ProgressListener;
import com.bko.stravacache.harvest.StopReason;
import com.bko.stravacache.ratelimit.RateLimitTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one batch run. Counters, results and progress delivery share one monitor, so events
 * reach the listener one at a time and each carries counters consistent with the ids resolved so far.
 */
final class BatchJob {
    private static final Logger logger = LoggerFactory.getLogger(BatchJob.class);

    private final List<String> activityIds;
    private final ProgressListener listener;
    private final RateLimitTracker rateLimitTracker;

    private final Map<String, ActivityBundle> bundles = new HashMap<>();
    private final Map<String, String> failures = new HashMap<>();
    private int fromCache;
    private int fetched;
    private int failed;
    private int skippedRateLimit;
    private boolean cutByDeadline;

    BatchJob(List<String> activityIds, ProgressListener listener, RateLimitTracker rateLimitTracker) {
        this.activityIds = activityIds;
        this.listener = listener;
        this.rateLimitTracker = rateLimitTracker;
    }

    synchronized void start() {
        emit(BatchPhase.STARTING, null, null);
    }

    synchronized void servedFromCache(String activityId, ActivityBundle bundle) {
        bundles.put(activityId, bundle);
        fromCache++;
        emit(BatchPhase.FETCHING_ACTIVITIES, activityId, null);
    }

    synchronized void fetched(String activityId, ActivityBundle bundle) {
        bundles.put(activityId, bundle);
        fetched++;
        emit(BatchPhase.FETCHING_ACTIVITIES, activityId, null);
    }

    /**
     * @param bundle data that was fetched but could not be persisted, {@code null} when the fetch itself failed
     */
    synchronized void failed(String activityId, String message, ActivityBundle bundle) {
        if (bundle != null) {
            bundles.put(activityId, bundle);
        }
        failures.put(activityId, message);
        failed++;
        emit(BatchPhase.FETCHING_ACTIVITIES, activityId, message);
    }

    synchronized void stopped(String reason) {
        emit(BatchPhase.RATE_LIMITED, null, reason);
    }

    synchronized void skipped(String activityId) {
        skippedRateLimit++;
        emit(BatchPhase.RATE_LIMITED, activityId, null);
    }

    /**
     * An id that was already being fetched when the job deadline passed.
     */
    synchronized void skippedAtDeadline(String activityId) {
        cutByDeadline = true;
        skipped(activityId);
    }

    synchronized boolean cutByDeadline() {
        return cutByDeadline;
    }

    synchronized BatchCounters counters() {
        int total = activityIds.size();
        int remaining = total - fromCache - fetched - failed - skippedRateLimit;
        return new BatchCounters(total, fromCache, fetched, failed, skippedRateLimit, remaining);
    }

    synchronized BatchResult toResult(StopReason stopReason) {
        Map<String, ActivityBundle> ordered = new LinkedHashMap<>();
        Map<String, String> orderedFailures = new LinkedHashMap<>();
        for (String id : activityIds) {
            ActivityBundle bundle = bundles.get(id);
            if (bundle != null) {
                ordered.put(id, bundle);
            }
            String failure = failures.get(id);
            if (failure != null) {
                orderedFailures.put(id, failure);
            }
        }
        BatchStatus status = skippedRateLimit > 0 ? BatchStatus.PARTIAL : BatchStatus.COMPLETE;
        return new BatchResult(status, counters(), ordered, orderedFailures, stopReason, rateLimitTracker.getInfo());
    }

    private void emit(BatchPhase phase, String activityId, String detail) {
        BatchCounters counters = counters();
        BatchPhase effective = counters.remaining() == 0 ? BatchPhase.COMPLETE : phase;
        try {
            listener.onProgress(new BatchProgress(effective, counters, activityId, rateLimitTracker.getInfo(), detail));
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed: {}", e.getMessage());
        }
    }
}
