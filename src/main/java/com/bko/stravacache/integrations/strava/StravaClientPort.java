package com.bko.stravacache.integrations.strava;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.time.Instant;

/**
 * One upstream call per method, returning the response body as Strava sent it. Use {@link StravaJson}
 * for typed views. Any transport failure or non-2xx response is an {@link IOException}.
 */
public interface StravaClientPort {
    default JsonNode getAthleteActivities(String accessToken, int page, int perPage) throws IOException {
        return getAthleteActivities(accessToken, page, perPage, null, null);
    }

    /**
     * @return a JSON array of activity summaries
     */
    JsonNode getAthleteActivities(String accessToken, int page, int perPage, Instant after, Instant before) throws IOException;
    JsonNode fetchActivityDetail(String accessToken, String activityId) throws IOException;
    JsonNode fetchPhotos(String accessToken, String activityId) throws IOException;
    JsonNode fetchComments(String accessToken, String activityId) throws IOException;
    JsonNode fetchLaps(String accessToken, String activityId) throws IOException;

    /**
     * @return streams keyed by type, or an empty object for activities without streams
     */
    JsonNode fetchStreams(String accessToken, String activityId) throws IOException;
}
