package com.bko.stravacache.harvest;

import java.io.IOException;

public interface ComprehensiveActivityUseCase {
    /**
     * Full bundle (including streams) for one activity, cache first.
     *
     * @throws IOException              when Strava could not deliver a missing resource
     * @throws QuotaExhaustedException  when the rate limit leaves no room for the missing resources
     */
    ComprehensiveActivity getComprehensiveActivity(String accessToken, String activityId, String athleteId, boolean forceRefresh) throws IOException;
}
