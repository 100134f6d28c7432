package com.bko.stravacache.harvest;

import com.bko.stravacache.integrations.strava.StravaActivity;
import com.bko.stravacache.integrations.strava.StravaComment;
import com.bko.stravacache.integrations.strava.StravaJson;
import com.bko.stravacache.integrations.strava.StravaLap;
import com.bko.stravacache.integrations.strava.StravaPhoto;
import com.bko.stravacache.integrations.strava.StravaStream;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything the book renderer needs for one activity, assembled from independently cached or fetched resources.
 * Each part is the Strava response exactly as received. Resources that were not requested or not available
 * are empty arrays (or an empty object for streams); {@code activity} is {@code null} when the detail is absent.
 *
 * @param fetchedAt when the oldest part of this bundle was fetched from Strava
 */
public record ActivityBundle(
        String activityId,
        String athleteId,
        JsonNode activity,
        JsonNode laps,
        JsonNode comments,
        JsonNode photos,
        JsonNode streams,
        Instant fetchedAt
) {
    public StravaActivity activityDetail() {
        return StravaJson.activity(activity);
    }

    public List<StravaLap> lapList() {
        return StravaJson.laps(laps);
    }

    public List<StravaComment> commentList() {
        return StravaJson.comments(comments);
    }

    public List<StravaPhoto> photoList() {
        return StravaJson.photos(photos);
    }

    public Map<String, StravaStream> streamMap() {
        return StravaJson.streams(streams);
    }
}
