package com.bko.stravacache.cache;

import java.io.IOException;
import java.util.List;

public interface CacheAdminUseCase {
    CacheStats getStats();

    int clearAll() throws IOException;

    /**
     * @throws IllegalArgumentException when {@code days < 1}
     */
    int clearOlderThan(int days) throws IOException;

    /**
     * @param athleteId athlete to list, or {@code null} for every athlete
     */
    List<String> listCachedActivityIds(String athleteId);

    List<CachedAthlete> listCachedAthletes();

    /**
     * Removes every cached resource of one activity. Returns the number of entries removed.
     */
    int deleteActivity(String athleteId, String activityId) throws IOException;
}
