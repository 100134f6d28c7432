package com.bko.stravacache.harvest;

import java.util.List;

public interface BatchFetchUseCase {
    /**
     * Resolves every id from cache or Strava. Per-item failures and quota exhaustion are reported in the
     * result; only malformed arguments throw.
     *
     * @throws IllegalArgumentException for a blank token or athlete id, an empty id list or invalid options
     */
    BatchResult batchFetch(String accessToken, List<String> activityIds, String athleteId, BatchOptions options);
}
