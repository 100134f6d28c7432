package com.bko.stravacache.harvest;

/**
 * @param year  calendar year, required for {@link HarvestMode#YEAR}
 * @param limit maximum number of activities to process
 */
public record HarvestRequest(HarvestMode mode, Integer year, int limit) {
    public static final int DEFAULT_LIMIT = 100;

    public HarvestRequest {
        if (mode == null) {
            mode = HarvestMode.RECENT;
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        if (mode == HarvestMode.YEAR && year == null) {
            throw new IllegalArgumentException("year is required for year mode");
        }
    }
}
