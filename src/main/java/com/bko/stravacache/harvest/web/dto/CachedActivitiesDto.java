package com.bko.stravacache.harvest.web.dto;

import com.bko.stravacache.cache.CachedAthlete;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CachedActivitiesDto(
        String athleteId,
        List<JsonNode> activities,
        List<CachedAthlete> athletes
) {
    public static CachedActivitiesDto forAthlete(String athleteId, List<JsonNode> activities) {
        return new CachedActivitiesDto(athleteId, activities, null);
    }

    public static CachedActivitiesDto athletes(List<CachedAthlete> athletes) {
        return new CachedActivitiesDto(null, null, athletes);
    }
}
