package com.bko.stravacache.harvest.app;

import com.bko.stravacache.harvest.ActivityBundle;
import com.bko.stravacache.harvest.BatchFetchUseCase;
import com.bko.stravacache.harvest.BatchOptions;
import com.bko.stravacache.harvest.BatchResult;
import com.bko.stravacache.harvest.ComprehensiveActivity;
import com.bko.stravacache.harvest.ComprehensiveActivityUseCase;
import com.bko.stravacache.harvest.QuotaExhaustedException;
import com.bko.stravacache.harvest.StopReason;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

@Service
public class ComprehensiveActivityService implements ComprehensiveActivityUseCase {
    private final BatchFetchUseCase batchFetch;

    public ComprehensiveActivityService(BatchFetchUseCase batchFetch) {
        this.batchFetch = batchFetch;
    }

    @Override
    public ComprehensiveActivity getComprehensiveActivity(String accessToken, String activityId, String athleteId,
                                                          boolean forceRefresh) throws IOException {
        BatchOptions options = BatchOptions.defaults()
                .withStreams()
                .withMaxConcurrent(1)
                .withForceRefresh(forceRefresh);
        BatchResult result = batchFetch.batchFetch(accessToken, List.of(activityId), athleteId, options);

        if (result.counters().skippedRateLimit() > 0) {
            String message = result.stopReason() == StopReason.RATE_LIMIT
                    ? "Rate limit leaves no room to fetch activity " + activityId
                    : "Could not schedule fetch of activity " + activityId + " (" + result.stopReason().label() + ")";
            throw new QuotaExhaustedException(message, result.rateLimit());
        }
        ActivityBundle bundle = result.results().get(activityId.trim());
        if (bundle == null) {
            throw new IOException("Failed to fetch activity " + activityId + ": " + result.failures().get(activityId.trim()));
        }
        return new ComprehensiveActivity(bundle, result.counters().fromCache() == 1, bundle.fetchedAt());
    }
}
