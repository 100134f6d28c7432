package com.bko.stravacache.harvest;

import java.io.IOException;

public interface HarvestUseCase {
    /**
     * Lists the athlete's activities for the requested period and caches what the book renderer needs for them.
     *
     * @throws IOException when the activity list itself could not be fetched
     */
    HarvestSummary harvest(String accessToken, String athleteId, HarvestRequest request) throws IOException;
}
